package configreader.expression.node;

import lombok.Getter;

@Getter
public final class UnaryOpNode extends ExpressionNode {

    private final UnaryOperator operator;
    private final ExpressionNode operand;

    public UnaryOpNode(int position, UnaryOperator operator, ExpressionNode operand) {
        super(NodeKind.UNARY_OPERATION, position, depthOf(operand));
        this.operator = operator;
        this.operand = operand;
    }
}

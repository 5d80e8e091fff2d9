package configreader.expression.node;

import lombok.Getter;

@Getter
public final class BinaryOpNode extends ExpressionNode {

    private final BinaryOperator operator;
    private final ExpressionNode left;
    private final ExpressionNode right;

    public BinaryOpNode(int position, BinaryOperator operator, ExpressionNode left, ExpressionNode right) {
        super(NodeKind.BINARY_OPERATION, position, depthOf(left, right));
        this.operator = operator;
        this.left = left;
        this.right = right;
    }
}

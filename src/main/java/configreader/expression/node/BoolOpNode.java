package configreader.expression.node;

import java.util.List;
import lombok.Getter;

@Getter
public final class BoolOpNode extends ExpressionNode {

    private final BoolOperator operator;
    private final List<ExpressionNode> operands;

    public BoolOpNode(int position, BoolOperator operator, List<ExpressionNode> operands) {
        super(NodeKind.BOOLEAN_OPERATION, position, depthOf(operands));
        this.operator = operator;
        this.operands = List.copyOf(operands);
    }
}

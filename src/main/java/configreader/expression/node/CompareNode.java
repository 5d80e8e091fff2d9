package configreader.expression.node;

import java.util.List;
import lombok.Getter;

/**
 * {@code left op1 c1 op2 c2 ...}; {@code operators} and {@code comparators}
 * have the same length.
 */
@Getter
public final class CompareNode extends ExpressionNode {

    private final ExpressionNode left;
    private final List<CompareOperator> operators;
    private final List<ExpressionNode> comparators;

    public CompareNode(int position, ExpressionNode left, List<CompareOperator> operators,
                       List<ExpressionNode> comparators) {
        super(NodeKind.COMPARISON, position, Math.max(depthOf(left), depthOf(comparators)));
        this.left = left;
        this.operators = List.copyOf(operators);
        this.comparators = List.copyOf(comparators);
    }
}

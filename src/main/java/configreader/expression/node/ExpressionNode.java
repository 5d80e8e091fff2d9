package configreader.expression.node;

import lombok.Getter;

import java.util.List;

/**
 * Immutable syntax tree node. {@link #getKind()} is the dispatch key of the
 * evaluator. {@link #getDepth()} is the height of the subtree rooted here,
 * 1 for a leaf.
 */
@Getter
public abstract class ExpressionNode {

    private final NodeKind kind;
    private final int position;
    private final int depth;

    protected ExpressionNode(NodeKind kind, int position) {
        this(kind, position, 1);
    }

    protected ExpressionNode(NodeKind kind, int position, int depth) {
        this.kind = kind;
        this.position = position;
        this.depth = depth;
    }

    protected static int depthOf(ExpressionNode... children) {
        int max = 0;
        for (ExpressionNode child : children) {
            max = Math.max(max, child.depth);
        }
        return max + 1;
    }

    protected static int depthOf(List<ExpressionNode> children) {
        return depthOf(children.toArray(new ExpressionNode[0]));
    }
}

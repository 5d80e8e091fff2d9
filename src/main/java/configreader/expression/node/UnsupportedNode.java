package configreader.expression.node;

import lombok.Getter;

/**
 * A recognised form the evaluator never interprets. Only its kind and source
 * text are kept.
 */
@Getter
public final class UnsupportedNode extends ExpressionNode {

    private final String text;

    public UnsupportedNode(NodeKind kind, int position, String text) {
        super(kind, position);
        this.text = text;
    }
}

package configreader.expression.node;

import configreader.value.Value;
import lombok.Getter;

/**
 * Number, boolean, string or {@code None} literal. {@code value} is null for
 * {@code None}.
 */
@Getter
public final class LiteralNode extends ExpressionNode {

    private final Value value;

    public LiteralNode(NodeKind kind, int position, Value value) {
        super(kind, position);
        this.value = value;
    }
}

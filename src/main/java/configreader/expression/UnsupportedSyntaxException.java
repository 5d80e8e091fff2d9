package configreader.expression;

import configreader.expression.node.NodeKind;
import lombok.Getter;

/**
 * Raised for every syntax form outside the evaluator's whitelist.
 */
@Getter
public class UnsupportedSyntaxException extends ExpressionException {

    private final NodeKind kind;

    public UnsupportedSyntaxException(NodeKind kind) {
        this(kind, "Forbidden syntax: " + kind.getDescription());
    }

    public UnsupportedSyntaxException(NodeKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}

package configreader.expression.node;

import java.util.List;
import lombok.Getter;

/**
 * Root of every parse: the statements of the input in order.
 */
@Getter
public final class StatementsNode extends ExpressionNode {

    private final List<ExpressionNode> statements;

    public StatementsNode(List<ExpressionNode> statements) {
        super(NodeKind.STATEMENTS, 0, depthOf(statements));
        this.statements = List.copyOf(statements);
    }
}

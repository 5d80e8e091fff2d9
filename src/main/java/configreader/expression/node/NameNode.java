package configreader.expression.node;

import lombok.Getter;

@Getter
public final class NameNode extends ExpressionNode {

    private final String identifier;

    public NameNode(int position, String identifier) {
        super(NodeKind.NAME, position);
        this.identifier = identifier;
    }
}

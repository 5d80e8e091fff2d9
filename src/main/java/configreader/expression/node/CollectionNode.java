package configreader.expression.node;

import java.util.List;
import lombok.Getter;

/**
 * List, tuple or set display.
 */
@Getter
public final class CollectionNode extends ExpressionNode {

    private final List<ExpressionNode> elements;

    public CollectionNode(NodeKind kind, int position, List<ExpressionNode> elements) {
        super(kind, position, depthOf(elements));
        this.elements = List.copyOf(elements);
    }
}

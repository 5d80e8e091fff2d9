package configreader.expression.node;

import java.util.List;
import lombok.Getter;

@Getter
public final class DictNode extends ExpressionNode {

    private final List<ExpressionNode> keys;
    private final List<ExpressionNode> values;

    public DictNode(int position, List<ExpressionNode> keys, List<ExpressionNode> values) {
        super(NodeKind.DICT, position, Math.max(depthOf(keys), depthOf(values)));
        this.keys = List.copyOf(keys);
        this.values = List.copyOf(values);
    }
}

package configreader.expression.node;

import java.util.List;
import lombok.Getter;

@Getter
public final class CallNode extends ExpressionNode {

    private final ExpressionNode function;
    private final List<ExpressionNode> arguments;
    private final List<KeywordArgument> keywords;

    public CallNode(int position, ExpressionNode function, List<ExpressionNode> arguments,
                    List<KeywordArgument> keywords) {
        super(NodeKind.CALL, position,
                Math.max(depthOf(function), Math.max(depthOf(arguments), keywordDepth(keywords) + 1)));
        this.function = function;
        this.arguments = List.copyOf(arguments);
        this.keywords = List.copyOf(keywords);
    }

    private static int keywordDepth(List<KeywordArgument> keywords) {
        int max = 0;
        for (KeywordArgument keyword : keywords) {
            max = Math.max(max, keyword.getValue().getDepth());
        }
        return max;
    }
}

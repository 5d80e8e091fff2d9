package configreader.expression.node;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public final class KeywordArgument {

    private final String name;
    private final ExpressionNode value;
}

package configreader.section;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Draws a section and its subtree with box-drawing connectors. Child sections
 * come before the content of their parent, both in insertion order:
 * <pre>
 * Config/
 *  ├─detectors/
 *  │  ├─det1/
 *  │  │  └─height = 1.5
 *  │  └─width = 2
 *  └─Sampler/
 *     └─sampler_name = custom
 * </pre>
 */
public final class SectionPrinter {

    private static final String BLANK = "   ";
    private static final String VERTICAL = " │ ";
    private static final String CORNER = " └─";
    private static final String TEE = " ├─";

    private SectionPrinter() {
    }

    public static String print(Section section) {
        List<Line> lines = new ArrayList<>();
        collect(section, 0, lines);
        int maxLevel = lines.stream().mapToInt(Line::getLevel).max().orElse(0);

        String[][] grid = new String[lines.size()][maxLevel + 1];
        for (String[] row : grid) {
            Arrays.fill(row, BLANK);
        }
        for (int i = 0; i < lines.size(); i++) {
            int level = lines.get(i).getLevel();
            grid[i][level] = CORNER;
            for (int j = i - 1; j >= 0; j--) {
                int previous = lines.get(j).getLevel();
                if (previous > level) {
                    grid[j][level] = VERTICAL;
                } else {
                    if (previous == level) {
                        grid[j][level] = TEE;
                    }
                    break;
                }
            }
        }

        StringBuilder out = new StringBuilder(lines.get(0).getText());
        for (int i = 1; i < lines.size(); i++) {
            StringBuilder row = new StringBuilder();
            for (int column = 1; column <= lines.get(i).getLevel(); column++) {
                row.append(grid[i][column]);
            }
            row.append(lines.get(i).getText());
            out.append('\n').append(StringUtils.stripEnd(row.toString(), null));
        }
        return out.toString();
    }

    private static void collect(Section section, int level, List<Line> lines) {
        lines.add(new Line(section.getName() + section.getSeparator(), level));
        for (Section child : section.getChildren().values()) {
            collect(child, level + 1, lines);
        }
        section.getContent().forEach((key, value) -> lines.add(new Line(key + " = " + value, level + 1)));
    }

    @Getter
    @RequiredArgsConstructor
    private static final class Line {
        private final String text;
        private final int level;
    }
}

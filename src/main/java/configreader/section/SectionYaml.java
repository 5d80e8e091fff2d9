package configreader.section;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Block-style YAML rendering of {@link Section#toMap(boolean)}.
 */
public final class SectionYaml {

    private final Yaml yaml;

    public SectionYaml() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(false);
        options.setIndent(2);
        options.setIndicatorIndent(2);
        options.setIndentWithIndicator(true);
        this.yaml = new Yaml(options);
    }

    public String dump(Section section) {
        return yaml.dump(section.toMap(false));
    }
}

package io.github.yok.flexschemasync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class for the file-system locations used by push and pull.
 *
 * <ul>
 * <li>{@code paths.tab}: directory containing one {@code <tablename>.sql} file per table, usually
 * produced by {@code mysqldump --no-data --tab=<dir>}</li>
 * <li>{@code paths.push-script-export-path}: file the assembled push script is written to; when
 * blank a time-stamped file in the working directory is used</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "paths")
@Data
public class PathsConfig {

    // Directory holding the per-table schema files
    private String tab = "./skeema-repo-root";

    // Export path of the push script (blank means push_script_<timestamp>.sql)
    private String pushScriptExportPath;
}

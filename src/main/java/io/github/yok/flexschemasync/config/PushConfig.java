package io.github.yok.flexschemasync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds settings related to push operations.
 *
 * <p>
 * You can specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code push.scratch-db-name}: name of the scratch database the schema files are loaded
 * into</li>
 * <li>{@code push.retains-tmp}: keep the scratch database after the run</li>
 * <li>{@code push.dry-run}: write the push script without executing it</li>
 * <li>{@code push.diff-command}: executable of the structural diff tool</li>
 * <li>{@code push.diff-failure-policy}: {@link DiffFailurePolicy} applied to failed diffs</li>
 * <li>{@code push.diff-parallelism}: number of diff commands run at the same time</li>
 * <li>{@code push.schema-file-suffix}: suffix identifying schema files</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "push")
@Getter
@Setter
@NoArgsConstructor
public class PushConfig {

    private String scratchDbName = "tmp";

    private boolean retainsTmp = true;

    private boolean dryRun = false;

    private String diffCommand = "mysqldiff";

    private DiffFailurePolicy diffFailurePolicy = DiffFailurePolicy.ABORT;

    private int diffParallelism = 1;

    private String schemaFileSuffix = ".sql";
}

package io.github.yok.flexschemasync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds settings related to pull operations.
 *
 * <ul>
 * <li>{@code pull.dump-command}: executable of the schema dump tool</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "pull")
@Getter
@Setter
@NoArgsConstructor
public class PullConfig {

    private String dumpCommand = "mysqldump";
}

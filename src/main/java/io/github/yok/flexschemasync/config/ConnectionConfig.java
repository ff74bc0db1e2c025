package io.github.yok.flexschemasync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the MySQL server connection settings loaded from
 * {@code application.yml}.
 *
 * <pre>
 * connection:
 *   host: localhost
 *   port: 3306
 *   user: root
 *   password:
 *   live-db-name: app
 *   url-options: allowMultiQueries=true
 * </pre>
 *
 * <p>
 * Every value can be overridden from the command line ({@code --host}, {@code --port},
 * {@code --user}, {@code --password} and the positional live database name).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // MySQL server host name
    private String host = "localhost";
    // MySQL server port
    private int port = 3306;
    // Database user name
    private String user = "root";
    // Raw password; null or empty means "connect without password"
    private String password;
    // Name of the live database compared with the scratch database
    private String liveDbName;
    // Query string appended to every JDBC URL (multi statements are required for the push script)
    private String urlOptions = "allowMultiQueries=true";
}

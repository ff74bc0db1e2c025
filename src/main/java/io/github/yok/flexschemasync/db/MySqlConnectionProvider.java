package io.github.yok.flexschemasync.db;

import io.github.yok.flexschemasync.config.RunSettings;
import io.github.yok.flexschemasync.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link DbConnectionProvider} for MySQL through {@link DriverManager}.
 *
 * <p>
 * URLs have the form {@code jdbc:mysql://host:port/[database][?urlOptions]}. The default
 * {@code allowMultiQueries=true} lets a schema file or the whole push script run as one batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MySqlConnectionProvider implements DbConnectionProvider {

    private final RunSettings settings;

    /**
     * Creates a provider.
     *
     * @param settings run settings with host, port, credentials and live database name
     */
    public MySqlConnectionProvider(RunSettings settings) {
        this.settings = settings;
    }

    @Override
    public Connection openLive() throws SQLException {
        return open(buildUrl(settings.getLiveDbName()));
    }

    @Override
    public Connection openServer() throws SQLException {
        return open(buildUrl(null));
    }

    /**
     * Builds a JDBC URL.
     *
     * @param database default database, or {@code null} for none
     * @return JDBC URL
     */
    String buildUrl(String database) {
        StringBuilder url = new StringBuilder("jdbc:mysql://").append(settings.getHost())
                .append(':').append(settings.getPort()).append('/');
        if (database != null) {
            url.append(database);
        }
        if (StringUtils.isNotBlank(settings.getUrlOptions())) {
            url.append('?').append(settings.getUrlOptions());
        }
        return url.toString();
    }

    private Connection open(String url) throws SQLException {
        log.info("Connecting to {} as {}", MaskingLogUtil.maskJdbcUrl(url), settings.getUser());
        if (settings.hasPassword()) {
            return DriverManager.getConnection(url, settings.getUser(), settings.getPassword());
        }
        return DriverManager.getConnection(url, settings.getUser(), null);
    }
}

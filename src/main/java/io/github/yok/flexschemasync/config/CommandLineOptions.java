package io.github.yok.flexschemasync.config;

import lombok.Data;

/**
 * Raw values parsed from the command line.
 *
 * <p>
 * A {@code null} field means "not given" and leaves the value from {@code application.yml} in
 * place.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class CommandLineOptions {

    // Positional 1: live database name
    private String liveDbName;
    // Positional 2: push or pull
    private String direction;
    // --tab
    private String tab;
    // --host
    private String host;
    // --port
    private String port;
    // --user
    private String user;
    // --password
    private String password;
    // --retainsTmp
    private Boolean retainsTmp;
    // --pushScriptExportPath
    private String pushScriptExportPath;
    // --dryRunPush
    private Boolean dryRunPush;
}

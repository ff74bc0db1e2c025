package io.github.yok.flexschemasync.model;

/**
 * Kind of statement a {@link ScriptFragment} contributes to the push script.
 *
 * @author Yasuharu.Okawauchi
 */
public enum FragmentKind {

    /** Table defined only in files: its full CREATE statement. */
    CREATE,

    /** Table present only live: {@code DROP TABLE IF EXISTS}. */
    DROP,

    /** Table on both sides: output of the structural diff, possibly empty. */
    ALTER
}

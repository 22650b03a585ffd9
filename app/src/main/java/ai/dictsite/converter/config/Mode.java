package ai.dictsite.converter.config;

/**
 * Whether the run converts one file or every matching file of a folder.
 */
public enum Mode {
    SINGLE,
    FOLDER
}

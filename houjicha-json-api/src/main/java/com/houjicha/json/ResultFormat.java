package com.houjicha.json;

/**
 * Shape of a serialized {@link com.houjicha.ParseResult}.
 *
 * @param file            source label written as {@code "file"}, or null to omit it
 * @param includeDocument false to write only the errors
 * @param pretty          indent the output
 */
public record ResultFormat(String file, boolean includeDocument, boolean pretty) {

    public static final ResultFormat COMPACT = new ResultFormat(null, true, false);

    public ResultFormat forFile(String file) {
        return new ResultFormat(file, includeDocument, pretty);
    }
}

package com.tyron.multicode.core.generate;

/**
 * Minimal post-processing for generated code.
 */
public final class CodeFormatter {

    private CodeFormatter() {
    }

    /**
     * Prefixes every non-blank line with one indentation unit. Blank lines are emptied.
     *
     * @param width number of spaces per unit; ignored for {@link IndentStyle#TABS}
     */
    public static String indent(String code, int width, IndentStyle style) {
        String unit = style == IndentStyle.TABS ? "\t" : " ".repeat(Math.max(0, width));
        if (unit.isEmpty()) {
            return code;
        }
        StringBuilder out = new StringBuilder(code.length() + unit.length() * 8);
        int start = 0;
        while (start <= code.length()) {
            int nl = code.indexOf('\n', start);
            int end = nl < 0 ? code.length() : nl;
            String line = code.substring(start, end);
            if (!line.isBlank()) {
                out.append(unit).append(line);
            }
            if (nl < 0) {
                break;
            }
            out.append('\n');
            start = nl + 1;
        }
        return out.toString();
    }
}

package org.smtlower.lambda;

import lombok.Getter;

import java.util.List;

/**
 * lowering 失败。失败是原子的：抛出时不会留下部分结果。
 */
@Getter
public abstract class LoweringException extends RuntimeException {

    private final String title;
    private final List<String> details;

    protected LoweringException(String banner, String title, List<String> details, String footer) {
        super(format(banner, title, details, footer));
        this.title = title;
        this.details = List.copyOf(details);
    }

    private static String format(String banner, String title, List<String> details, String footer) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n*** ").append(banner).append('\n');
        sb.append("***\n");
        sb.append("***   ").append(title).append('\n');
        for (String d : details) {
            sb.append("***     Saw: ").append(d).append('\n');
        }
        sb.append("***\n");
        sb.append("*** ").append(footer);
        return sb.toString();
    }
}

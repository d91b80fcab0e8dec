package org.smtlower.lambda;

import lombok.Getter;

import java.util.List;

/**
 * 单项回放检查的结果。
 */
@Getter
public final class CheckOutcome {

    public enum Status {
        OK,
        UNSUPPORTED,
        INCONSISTENT
    }

    private static final CheckOutcome OK = new CheckOutcome(Status.OK, "", List.of());

    private final Status status;
    private final String title;
    private final List<String> details;

    private CheckOutcome(Status status, String title, List<String> details) {
        this.status = status;
        this.title = title;
        this.details = List.copyOf(details);
    }

    public static CheckOutcome ok() {
        return OK;
    }

    public static CheckOutcome unsupported(String title, List<String> details) {
        return new CheckOutcome(Status.UNSUPPORTED, title, details);
    }

    public static CheckOutcome inconsistent(String title, List<String> details) {
        return new CheckOutcome(Status.INCONSISTENT, title, details);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * 把失败结果转成对应的异常。
     * @throws IllegalStateException 如果结果是 OK。
     */
    public LoweringException toException() {
        return switch (status) {
            case UNSUPPORTED -> new UnsupportedConstructException(title, details);
            case INCONSISTENT -> new InternalInconsistencyException(title, details);
            case OK -> throw new IllegalStateException("OK 的检查结果没有对应的异常");
        };
    }

    @Override
    public String toString() {
        return isOk() ? "OK" : status + ": " + title + " " + details;
    }
}

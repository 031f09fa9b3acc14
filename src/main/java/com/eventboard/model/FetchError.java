package com.eventboard.model;

/**
 * Why a page request failed. {@code httpStatus} is only meaningful for {@link FetchErrorKind#HTTP}.
 */
public final class FetchError {
    public final FetchErrorKind kind;
    public final int httpStatus;
    public final String message;
    public final int page;

    private FetchError(FetchErrorKind kind, int httpStatus, String message, int page) {
        this.kind = kind == null ? FetchErrorKind.API : kind;
        this.httpStatus = httpStatus;
        this.message = message == null ? "" : message.trim();
        this.page = page;
    }

    public static FetchError transport(String message, int page) {
        return new FetchError(FetchErrorKind.TRANSPORT, 0, message, page);
    }

    public static FetchError http(int status, String message, int page) {
        return new FetchError(FetchErrorKind.HTTP, status, message, page);
    }

    public static FetchError api(String message, int page) {
        return new FetchError(FetchErrorKind.API, 0, message, page);
    }

    public static FetchError interrupted(int page) {
        return new FetchError(FetchErrorKind.INTERRUPTED, 0, "fetch interrupted", page);
    }

    public static FetchError of(FetchErrorKind kind, int httpStatus, String message, int page) {
        return new FetchError(kind, httpStatus, message, page);
    }

    /**
     * Human-readable reason, e.g. {@code "HTTP 503 on page 2"}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        switch (kind) {
            case HTTP:
                sb.append("HTTP ").append(httpStatus);
                break;
            case TRANSPORT:
                sb.append("transport error");
                break;
            case API:
                sb.append("API error");
                break;
            default:
                sb.append("interrupted");
                break;
        }
        if (page > 0) {
            sb.append(" on page ").append(page);
        }
        if (!message.isEmpty() && kind != FetchErrorKind.INTERRUPTED) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}

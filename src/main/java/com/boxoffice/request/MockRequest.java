package com.boxoffice.request;

/**
 * <p>
 * An in-memory {@link Request} which records the response instead of sending
 * it, e.g., for driving the service from tests.
 * </p>
 */
public class MockRequest extends Request {
    /**
     * Request body, consumed by {@link #readBody()}.
     */
    private String body;

    private int status = 0;
    private String response = null;

    /**
     * Constructs a new mock request; the kind is derived from the path.
     *
     * @param method Method of the request.
     * @param path   Path of the request.
     * @param body   Request body, may be empty.
     */
    public MockRequest(final Method method, final String path, final String body) {
        super(method, Kind.fromPath(path).orElseThrow(() -> new IllegalArgumentException("Unknown path " + path)),
                path);
        this.body = body;
    }

    @Override
    public String readBody() {
        final var res = this.body;
        this.body = "";
        return res;
    }

    private void record(final int code, final String content) {
        if (this.status != 0) {
            throw new IllegalStateException("Request has already been answered!");
        }
        this.status = code;
        this.response = content;
    }

    @Override
    public void respondWithError(final int code, final String message) {
        this.record(code, message == null ? "" : message);
    }

    @Override
    public void respondWithJson(final int code, final String json) {
        this.record(code, json);
    }

    @Override
    public void respondWithNoContent() {
        this.record(204, "");
    }

    /**
     * Returns the status code of the response, 0 while unanswered.
     *
     * @return HTTP status code.
     */
    public int getStatus() {
        return this.status;
    }

    /**
     * Returns the body of the response, {@code null} while unanswered.
     *
     * @return Response body.
     */
    public String getResponse() {
        return this.response;
    }
}

package com.piggyboss.vault.pojos;

/**
 * HTTP context of a Lambda Function URL event, found at requestContext.http.
 */
public class RequestContextHttp {
    private String method;
    private String path;
    private String sourceIp;

    public RequestContextHttp() {
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public void setSourceIp(String sourceIp) {
        this.sourceIp = sourceIp;
    }
}

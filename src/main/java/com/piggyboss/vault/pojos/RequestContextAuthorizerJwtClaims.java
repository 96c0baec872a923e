package com.piggyboss.vault.pojos;

public class RequestContextAuthorizerJwtClaims {
    private String user_id;
    private String email;

    public RequestContextAuthorizerJwtClaims() {
    }

    public String getUser_id() {
        return this.user_id;
    }

    public void setUser_id(String user_id) {
        this.user_id = user_id;
    }

    public String getEmail() {
        return this.email;
    }

    public void setEmail(String email) {
        this.email = email;
    }
}

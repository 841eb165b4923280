package com.ourd.router;

/** Methods path rules can be bound to. */
public enum HttpMethod {
    GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS
}

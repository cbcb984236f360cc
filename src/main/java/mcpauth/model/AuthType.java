package mcpauth.model;

public enum AuthType {
    NONE,
    OAUTH
}

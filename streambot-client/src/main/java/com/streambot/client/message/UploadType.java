package com.streambot.client.message;

/**
 * Media kinds accepted by the upload API.
 */
public enum UploadType {
    IMAGE("image"),
    VOICE("voice"),
    VIDEO("video"),
    FILE("file");

    private final String wireName;

    UploadType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

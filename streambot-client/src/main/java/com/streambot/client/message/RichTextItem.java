package com.streambot.client.message;

import lombok.Data;

/**
 * One segment of a rich text message: either text or a picture.
 */
@Data
public class RichTextItem {
    private String text;
    private String downloadCode;
    private String pictureDownloadCode;
    private String type;
}

package com.streambot.client.message;

import lombok.Data;

import java.util.List;

/**
 * Union of the inbound content shapes; which fields are set depends on
 * {@link RobotMessage#getMsgtype()}.
 */
@Data
public class MessageContent {
    /** text */
    private String content;

    /** picture, file, audio, video */
    private String downloadCode;
    /** picture */
    private String pictureDownloadCode;
    /** file */
    private String fileName;

    /** richText */
    private List<RichTextItem> richText;

    /** audio (ms) and video (s) */
    private Long duration;
    /** audio speech recognition result */
    private String recognition;
    /** video */
    private String videoType;

    /** set when the server sends a type this client does not model */
    private String unknownMsgType;
}

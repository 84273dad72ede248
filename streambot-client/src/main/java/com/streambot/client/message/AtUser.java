package com.streambot.client.message;

import lombok.Data;

@Data
public class AtUser {
    private String dingtalkId;
    private String staffId;
}

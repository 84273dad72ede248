package com.streambot.client.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
class SendResponse {
    private String processQueryKey;
    private List<String> invalidStaffIdList;
    private List<String> flowControlledStaffIdList;
}

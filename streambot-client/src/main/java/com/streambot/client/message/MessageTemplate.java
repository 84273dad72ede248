package com.streambot.client.message;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outbound robot message bodies. Each variant serialises to the
 * {@code msgParam} JSON of the send APIs; {@link #msgKey()} names it.
 */
public sealed interface MessageTemplate {

    @JsonIgnore
    String msgKey();

    record SampleText(String content) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleText";
        }
    }

    record SampleMarkdown(String title, String text) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleMarkdown";
        }
    }

    record SampleImageMsg(String photoURL) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleImageMsg";
        }
    }

    record SampleLink(String text, String title, String picUrl, String messageUrl) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleLink";
        }
    }

    record SampleActionCard(String title, String text, String singleTitle, String singleURL)
            implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleActionCard";
        }
    }

    record SampleActionCard2(String title, String text,
            String actionTitle1, String actionURL1,
            String actionTitle2, String actionURL2) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleActionCard2";
        }
    }

    record SampleActionCard3(String title, String text,
            String actionTitle1, String actionURL1,
            String actionTitle2, String actionURL2,
            String actionTitle3, String actionURL3) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleActionCard3";
        }
    }

    record SampleActionCard4(String title, String text,
            String actionTitle1, String actionURL1,
            String actionTitle2, String actionURL2,
            String actionTitle3, String actionURL3,
            String actionTitle4, String actionURL4) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleActionCard4";
        }
    }

    record SampleActionCard5(String title, String text,
            String actionTitle1, String actionURL1,
            String actionTitle2, String actionURL2,
            String actionTitle3, String actionURL3,
            String actionTitle4, String actionURL4,
            String actionTitle5, String actionURL5) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleActionCard5";
        }
    }

    /** Two horizontally laid out buttons. */
    record SampleActionCard6(String title, String text,
            String buttonTitle1, String buttonUrl1,
            String buttonTitle2, String buttonUrl2) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleActionCard6";
        }
    }

    /** {@code duration} is in milliseconds, as a string. */
    record SampleAudio(String mediaId, String duration) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleAudio";
        }
    }

    record SampleFile(String mediaId, String fileName, String fileType) implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleFile";
        }
    }

    /** {@code duration} is in seconds, as a string. */
    record SampleVideo(String duration, String videoMediaId, String videoType, String picMediaId)
            implements MessageTemplate {
        @Override
        public String msgKey() {
            return "sampleVideo";
        }
    }
}

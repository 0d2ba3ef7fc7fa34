package io.github.drompincen.repowatch.runtime.notify.dingtalk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DingTalkResponse(int errcode, String errmsg) {

    public boolean isOk() {
        return errcode == 0;
    }
}

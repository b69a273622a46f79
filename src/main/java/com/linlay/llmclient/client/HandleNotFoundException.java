package com.linlay.llmclient.client;

import com.linlay.llmclient.error.LlmErrorKind;
import com.linlay.llmclient.error.LlmException;

/**
 * 请求的 handle 未注册。路由不做任何回退。
 */
public class HandleNotFoundException extends LlmException {

    private final String handle;

    public HandleNotFoundException(String handle) {
        super(LlmErrorKind.VALIDATION, "handle not found: " + handle, null, null, null, null, null);
        this.handle = handle;
    }

    public String handle() {
        return handle;
    }
}

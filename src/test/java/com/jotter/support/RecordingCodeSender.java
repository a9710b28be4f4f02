package com.jotter.support;

import com.jotter.auth.verification.CodeSender;
import com.jotter.common.exception.BusinessException;
import com.jotter.common.exception.ErrorCode;

import java.util.ArrayList;
import java.util.List;

public class RecordingCodeSender implements CodeSender {

    public record Sent(String email, String code, int expireMinutes) {
    }

    private final List<Sent> sent = new ArrayList<>();
    private boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<Sent> sent() {
        return sent;
    }

    public String lastCode() {
        return sent.isEmpty() ? null : sent.get(sent.size() - 1).code();
    }

    @Override
    public void sendCode(String email, String code, int expireMinutes) {
        if (failing) {
            throw new BusinessException(ErrorCode.DELIVERY_FAILED);
        }
        sent.add(new Sent(email, code, expireMinutes));
    }
}

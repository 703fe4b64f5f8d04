package com.meltwater.rxjetstream;

public class NoopAckEventListener implements AckEventListener {

    @Override
    public String toString() {
        return "NoopAckEventListener";
    }
}

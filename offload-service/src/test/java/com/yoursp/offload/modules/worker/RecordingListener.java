package com.yoursp.offload.modules.worker;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

class RecordingListener implements WorkerChannel.Listener {

    private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
    private final BlockingQueue<Integer> exits = new LinkedBlockingQueue<>();

    @Override
    public void onMessage(String json) {
        messages.offer(json);
    }

    @Override
    public void onExit(int exitCode) {
        exits.offer(exitCode);
    }

    String nextMessage() throws InterruptedException {
        return messages.poll(5, TimeUnit.SECONDS);
    }

    Integer nextExit() throws InterruptedException {
        return exits.poll(5, TimeUnit.SECONDS);
    }

    int exitCount() {
        return exits.size();
    }

    int messageCount() {
        return messages.size();
    }
}

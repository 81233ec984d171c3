package com.ryuqq.lockfile.adapter.filesystem.process;

/**
 * Child process that stays alive until destroyed or 60 seconds pass.
 */
public final class IdleMain {

    private IdleMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        Thread.sleep(60_000);
    }
}

/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

public class CheckpointResult {

    private final CheckpointMode mode;
    private final int logFrames;
    private final int checkpointedFrames;

    public CheckpointResult(CheckpointMode mode, int logFrames, int checkpointedFrames) {
        this.mode = mode;
        this.logFrames = logFrames;
        this.checkpointedFrames = checkpointedFrames;
    }

    public CheckpointMode getMode() {
        return mode;
    }

    // WAL文件的总帧数
    public int getLogFrames() {
        return logFrames;
    }

    // 已经写回数据库文件的帧数
    public int getCheckpointedFrames() {
        return checkpointedFrames;
    }

    @Override
    public String toString() {
        return "CheckpointResult[mode=" + mode + ", logFrames=" + logFrames + ", checkpointedFrames="
                + checkpointedFrames + "]";
    }
}

package com.discusscall.core.media;

import com.discusscall.core.error.DeviceUnavailableException;
import com.discusscall.core.model.MediaKind;

import java.util.concurrent.CompletableFuture;

/**
 * 设备侧的媒体能力（麦克风、摄像头、音频路由）。
 * 运行环境没有原生媒体模块时不注册这个 bean，CapabilityDetector 会据此降级。
 */
public interface MediaPlatform {

    boolean hasPermission(MediaKind kind);

    /**
     * 弹出系统权限对话框。future 在用户作出选择后完成，true 为已授权；
     * 被 cancel 时平台应当收起对话框。
     */
    CompletableFuture<Boolean> requestPermission(MediaKind kind);

    /** 被拒绝后还能不能再弹一次框；不能时视为永久拒绝 */
    default boolean canAskAgain(MediaKind kind) {
        return true;
    }

    /** 切换到通话音频模式（全双工、听筒/扬声器路由） */
    void configureCallAudio();

    /**
     * @throws DeviceUnavailableException 设备被占用或无法启动采集
     */
    LocalMediaHandle open(MediaConstraints constraints);
}

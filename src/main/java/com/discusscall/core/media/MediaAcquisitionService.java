package com.discusscall.core.media;

import com.discusscall.core.config.CallProperties;
import com.discusscall.core.error.CallException;
import com.discusscall.core.error.DeviceUnavailableException;
import com.discusscall.core.error.PermissionDeniedException;
import com.discusscall.core.error.StrategyUnavailableException;
import com.discusscall.core.model.MediaKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 本地媒体采集。
 *
 * 权限只在真正发起/接听通话前才申请。等待用户点权限框的时间不受控，
 * 这期间 {@link #cancelPending()} 可以把等待打断；取消之后才打开的设备会被立刻释放。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MediaAcquisitionService {

    private final ObjectProvider<MediaPlatform> platformProvider;
    private final CallProperties properties;

    private final AtomicReference<CompletableFuture<Boolean>> pending = new AtomicReference<>();
    private final AtomicLong cancelGeneration = new AtomicLong();

    public boolean isAvailable() {
        return platformProvider.getIfAvailable() != null;
    }

    public boolean hasPermission(MediaKind kind) {
        MediaPlatform platform = platformProvider.getIfAvailable();
        return platform != null && platform.hasPermission(kind);
    }

    public LocalMediaHandle acquire(MediaKind kind) {
        MediaPlatform platform = platformProvider.getIfAvailable();
        if (platform == null) {
            throw new StrategyUnavailableException("no media platform in this runtime");
        }
        long generation = cancelGeneration.get();

        ensurePermission(platform, kind, generation);
        platform.configureCallAudio();

        LocalMediaHandle handle;
        try {
            handle = platform.open(MediaConstraints.forCall(kind, properties.getMedia()));
        } catch (CallException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DeviceUnavailableException("could not start " + kind.label() + " capture", e);
        }

        if (cancelGeneration.get() != generation) {
            handle.stop();
            throw CallException.cancelled("media acquisition cancelled");
        }
        log.info("Acquired local media: kind={}, tracks={}", kind, handle.getTracks().size());
        return handle;
    }

    /**
     * 取消正在进行的采集（例如用户在授权前挂断）。没有进行中的采集时只推进代数。
     */
    public void cancelPending() {
        cancelGeneration.incrementAndGet();
        CompletableFuture<Boolean> f = pending.getAndSet(null);
        if (f != null) {
            f.cancel(true);
            log.info("Cancelled pending media permission request");
        }
    }

    private void ensurePermission(MediaPlatform platform, MediaKind kind, long generation) {
        if (platform.hasPermission(kind)) {
            return;
        }
        log.info("Requesting {} permission", kind.label());
        CompletableFuture<Boolean> request = platform.requestPermission(kind);
        pending.set(request);
        if (cancelGeneration.get() != generation) {
            // 申请发出前就已经被取消
            request.cancel(true);
        }

        boolean granted;
        try {
            granted = Boolean.TRUE.equals(request.get());
        } catch (CancellationException e) {
            throw CallException.cancelled("permission request cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CallException.cancelled("interrupted while waiting for permission");
        } catch (ExecutionException e) {
            throw new DeviceUnavailableException("permission request failed", e.getCause());
        } finally {
            pending.compareAndSet(request, null);
        }

        if (!granted) {
            boolean permanent = !platform.canAskAgain(kind);
            log.warn("{} permission denied (permanent={})", kind.label(), permanent);
            throw new PermissionDeniedException(kind.label() + " permission denied", permanent);
        }
    }
}

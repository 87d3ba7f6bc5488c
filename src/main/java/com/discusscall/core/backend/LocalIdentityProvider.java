package com.discusscall.core.backend;

import com.discusscall.core.model.LocalIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 当前登录用户的身份，只查一次后端并缓存。
 * 后端返回的身份就是唯一依据，不做任何按人名的修正。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalIdentityProvider {

    private final DiscussBackend backend;

    private volatile LocalIdentity cached;

    /**
     * @throws OdooRpcException 后端查询失败
     */
    public LocalIdentity get() {
        LocalIdentity identity = cached;
        if (identity == null) {
            synchronized (this) {
                identity = cached;
                if (identity == null) {
                    identity = backend.currentIdentity();
                    cached = identity;
                    log.info("Resolved local identity: uid={}, partnerId={}, name={}",
                            identity.getUserId(), identity.getPartnerId(), identity.getName());
                }
            }
        }
        return identity;
    }

    public Optional<LocalIdentity> tryGet() {
        try {
            return Optional.of(get());
        } catch (OdooRpcException e) {
            log.warn("Local identity unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public synchronized void reset() {
        cached = null;
    }
}

package com.discusscall.core.registry;

import com.discusscall.core.backend.DiscussBackend;
import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.backend.OdooRpcException;
import com.discusscall.core.config.CallProperties;
import com.discusscall.core.error.NoMembershipException;
import com.discusscall.core.error.RegistryFailureException;
import com.discusscall.core.model.ConversationInfo;
import com.discusscall.core.model.LocalIdentity;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.model.SessionFlags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * “进行中通话”记录（discuss.channel.rtc.session）的增删改查。
 * 其他客户端和 Web 端靠这些记录知道有通话在响铃/进行。
 */
@Service
@Slf4j
public class SessionRegistryClient {

    private final DiscussBackend backend;
    private final LocalIdentityProvider identityProvider;
    private final CallProperties properties;
    private final ThreadPoolTaskScheduler executor;

    /** 本进程创建的记录 id -> 创建序号；超时后仍在跑的清理不会删掉它开始之后才建的记录 */
    private final Map<Long, Long> published = new HashMap<>();
    private final AtomicLong publishSeq = new AtomicLong();

    public SessionRegistryClient(DiscussBackend backend,
                                 LocalIdentityProvider identityProvider,
                                 CallProperties properties,
                                 ThreadPoolTaskScheduler callTaskScheduler) {
        this.backend = backend;
        this.identityProvider = identityProvider;
        this.properties = properties;
        this.executor = callTaskScheduler;
    }

    /**
     * 为当前用户在会话里创建一条通话记录。
     *
     * membership 只按当前用户查一次：群聊里缺失时补建，私聊里缺失直接报 NoMembership，
     * 绝不借用其他成员的 membership。
     */
    public RegistryRecord createSession(long conversationId, MediaKind kind) {
        try {
            LocalIdentity me = identityProvider.get();
            long membershipId = resolveMembership(conversationId, me.getPartnerId());
            SessionFlags flags = SessionFlags.initial(kind);
            long id;
            synchronized (published) {
                id = backend.createRtcSession(conversationId, membershipId, me.getPartnerId(), flags);
                published.put(id, publishSeq.incrementAndGet());
            }
            log.info("Created registry record {} in conversation {} (membership {})", id, conversationId, membershipId);
            return RegistryRecord.builder()
                    .id(id)
                    .conversationId(conversationId)
                    .membershipId(membershipId)
                    .partnerId(me.getPartnerId())
                    .partnerName(me.getName())
                    .flags(flags)
                    .build();
        } catch (OdooRpcException e) {
            throw new RegistryFailureException("could not create registry record in conversation " + conversationId, e);
        }
    }

    /**
     * 删除当前用户遗留的通话记录，conversationId 为 null 时清理全部会话。
     * 最多等待 cleanup-timeout，失败或超时只记日志，返回已确认删除的条数。
     */
    public int cleanupSessions(Long conversationId) {
        long startedAt = publishSeq.get();
        CompletableFuture<Integer> task = CompletableFuture.supplyAsync(() -> doCleanup(conversationId, startedAt), executor);
        try {
            return task.get(properties.getCleanupTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Registry cleanup still running after {}ms, continuing", properties.getCleanupTimeout().toMillis());
        } catch (ExecutionException e) {
            log.warn("Registry cleanup failed, continuing: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for registry cleanup");
        }
        return 0;
    }

    /**
     * 删除记录。幂等：记录已经不存在时不报错。
     */
    public void endSession(Long registryId) {
        if (registryId == null) return;
        try {
            backend.deleteRtcSessions(List.of(registryId));
            forget(registryId);
            log.info("Deleted registry record {}", registryId);
        } catch (OdooRpcException e) {
            boolean stillThere;
            try {
                stillThere = backend.readRtcSession(registryId).isPresent();
            } catch (OdooRpcException check) {
                throw new RegistryFailureException("could not delete registry record " + registryId, e);
            }
            if (stillThere) {
                throw new RegistryFailureException("could not delete registry record " + registryId, e);
            }
            forget(registryId);
            log.debug("Registry record {} already gone", registryId);
        }
    }

    /** 部分更新，值为 null 的字段不动 */
    public void updateFlags(long registryId, SessionFlags flags) {
        if (flags.isEmpty()) return;
        try {
            backend.updateRtcSession(registryId, flags);
        } catch (OdooRpcException e) {
            throw new RegistryFailureException("could not update registry record " + registryId, e);
        }
    }

    public Optional<RegistryRecord> findRecord(long registryId) {
        try {
            return backend.readRtcSession(registryId);
        } catch (OdooRpcException e) {
            throw new RegistryFailureException("could not read registry record " + registryId, e);
        }
    }

    public List<RegistryRecord> listRecords(long conversationId) {
        try {
            return backend.searchRtcSessions(conversationId, null);
        } catch (OdooRpcException e) {
            throw new RegistryFailureException("could not list registry records of " + conversationId, e);
        }
    }

    private long resolveMembership(long conversationId, long partnerId) {
        Optional<Long> existing = backend.findMembership(conversationId, partnerId);
        if (existing.isPresent()) {
            return existing.get();
        }
        ConversationInfo info = backend.readConversation(conversationId);
        if (info.isDirect()) {
            throw new NoMembershipException(conversationId, partnerId);
        }
        long created = backend.createMembership(conversationId, partnerId);
        log.info("Joined group conversation {} as membership {}", conversationId, created);
        return created;
    }

    private int doCleanup(Long conversationId, long startedAt) {
        long partnerId = identityProvider.get().getPartnerId();
        List<RegistryRecord> found = backend.searchRtcSessions(conversationId, partnerId);
        List<Long> ids;
        synchronized (published) {
            ids = found.stream()
                    .map(RegistryRecord::getId)
                    .filter(id -> published.getOrDefault(id, 0L) <= startedAt)
                    .toList();
        }
        if (ids.size() < found.size()) {
            log.debug("Cleanup skipped {} record(s) created after it started", found.size() - ids.size());
        }
        if (ids.isEmpty()) {
            return 0;
        }
        backend.deleteRtcSessions(ids);
        log.info("Cleaned up {} stale registry record(s): {}", ids.size(), ids);
        return ids.size();
    }

    private void forget(long registryId) {
        synchronized (published) {
            published.remove(registryId);
        }
    }
}

package com.discusscall.core.registry;

import com.discusscall.core.model.RegistryRecord;

public interface RegistryWatchListener {

    /** 本端或对端记录已经不在了 */
    void onRegistryRemoved(long registryId);

    /** 同一会话里出现了其他成员的记录 */
    void onParticipantJoined(RegistryRecord record);
}

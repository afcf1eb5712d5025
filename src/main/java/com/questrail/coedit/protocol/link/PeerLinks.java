package com.questrail.coedit.protocol.link;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open {@link PeerLink}s by link id.
 *
 * <p>Normally holds at most one link. During host-side preemption the old link
 * may linger briefly until its closure is reported.</p>
 */
public final class PeerLinks
{
    private final Map<Long, PeerLink> links = new ConcurrentHashMap<>();

    public void register(PeerLink link)
    {
        links.put(link.linkId(), link);
    }

    public Optional<PeerLink> get(long linkId)
    {
        return Optional.ofNullable(links.get(linkId));
    }

    public Optional<PeerLink> remove(long linkId)
    {
        return Optional.ofNullable(links.remove(linkId));
    }

    /**
     * Close and forget every link.
     */
    public void closeAll()
    {
        List<PeerLink> open = new ArrayList<>(links.values());
        links.clear();
        for (PeerLink link : open) {
            link.close(null);
        }
    }
}

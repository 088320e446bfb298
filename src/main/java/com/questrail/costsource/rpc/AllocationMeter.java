package com.questrail.costsource.rpc;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;

/**
 * AllocationMeter
 * -----------------------------------------------------------------------------
 * Best-effort per-thread heap allocation counter.
 *
 * <p>Backed by the HotSpot {@code com.sun.management.ThreadMXBean} extension.
 * On JVMs without it, or with allocation accounting disabled, every reading is
 * {@code -1} and callers report the allocation metric as unavailable.</p>
 */
public final class AllocationMeter
{
    public static final long UNAVAILABLE = -1L;

    private static final com.sun.management.ThreadMXBean BEAN = resolve();

    private AllocationMeter()
    {
    }

    public static boolean isAvailable()
    {
        return BEAN != null;
    }

    /**
     * Bytes allocated so far by the calling thread, or {@link #UNAVAILABLE}.
     */
    public static long currentThreadAllocatedBytes()
    {
        return (BEAN == null) ? UNAVAILABLE : BEAN.getCurrentThreadAllocatedBytes();
    }

    private static com.sun.management.ThreadMXBean resolve()
    {
        ThreadMXBean bean = ManagementFactory.getThreadMXBean();
        if (bean instanceof com.sun.management.ThreadMXBean hotspot
                && hotspot.isThreadAllocatedMemorySupported()) {
            if (!hotspot.isThreadAllocatedMemoryEnabled()) {
                hotspot.setThreadAllocatedMemoryEnabled(true);
            }
            return hotspot;
        }
        return null;
    }
}

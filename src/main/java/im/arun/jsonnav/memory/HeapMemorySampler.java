package im.arun.jsonnav.memory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * Reports used heap from the platform {@link MemoryMXBean}.
 */
public class HeapMemorySampler implements MemorySampler {
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    @Override
    public long usedBytes() {
        return memoryBean.getHeapMemoryUsage().getUsed();
    }
}

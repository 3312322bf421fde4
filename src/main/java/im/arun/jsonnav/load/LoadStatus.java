package im.arun.jsonnav.load;

import lombok.Value;

@Value
public class LoadStatus {
    int activeLoads;
    int availableSlots;
    int maxConcurrentLoads;
}

package im.arun.jsonnav.model;

import lombok.Value;

import java.util.List;

/**
 * One window of materialized children.
 */
@Value
public class ChildPage {
    List<LazyNode> children;
    int offset;
    int totalCount;
    boolean partial;

    public int nextOffset() {
        return offset + children.size();
    }
}

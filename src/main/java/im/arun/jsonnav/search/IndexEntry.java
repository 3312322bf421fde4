package im.arun.jsonnav.search;

import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.model.SearchMatchType;
import lombok.Value;

/**
 * One searchable text of one node: its key, its value preview or its path expression.
 */
@Value
public class IndexEntry {
    NodePath path;
    SearchMatchType matchType;
    String content;
}

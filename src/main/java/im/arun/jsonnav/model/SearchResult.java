package im.arun.jsonnav.model;

import lombok.Value;

@Value
public class SearchResult {
    NodePath path;
    SearchMatchType matchType;
    String matchedText;
    String context;
    int matchStart;
    int matchLength;
    double score;

    public String getPathExpression() {
        return path.toJsonPath();
    }

    @Override
    public String toString() {
        return getPathExpression() + ": " + matchedText;
    }
}

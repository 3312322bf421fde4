package im.arun.jsonnav.model;

import lombok.Data;

@Data
public class SearchOptions {
    private boolean caseSensitive = false;
    private boolean regex = false;
    private boolean wildcard = false;
    private boolean inKeys = true;
    private boolean inValues = true;
    private boolean inPaths = false;

    public static SearchOptions defaults() {
        return new SearchOptions();
    }

    public boolean includes(SearchMatchType type) {
        switch (type) {
            case KEY:
                return inKeys;
            case VALUE:
                return inValues;
            case PATH:
                return inPaths;
            default:
                return false;
        }
    }
}

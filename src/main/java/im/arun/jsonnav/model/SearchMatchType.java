package im.arun.jsonnav.model;

/**
 * Index category of a search hit. The weight drives ranking: key over value over path.
 */
public enum SearchMatchType {
    KEY(3.0),
    VALUE(2.0),
    PATH(1.0);

    private final double weight;

    SearchMatchType(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}

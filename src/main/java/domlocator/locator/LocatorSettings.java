package domlocator.locator;

/**
 * Bounds and switches for locator generation.
 *
 * @param maxDepth               maximum number of levels in an ancestor chain
 * @param textSelectorMaxLength  longest text used by the CSS text strategy
 * @param xpathTextMaxLength     longest text used by the XPath text strategy
 * @param classMaxCount          meaningful classes considered for combinations
 * @param classCombinationMaxSize largest class combination tried
 * @param positionParentDepth    levels in the parent path of an XPath position locator
 * @param verifyXpath            query the oracle for XPath candidates; when false,
 *                               candidates are accepted unverified and flagged non-unique
 */
public record LocatorSettings(int maxDepth,
                              int textSelectorMaxLength,
                              int xpathTextMaxLength,
                              int classMaxCount,
                              int classCombinationMaxSize,
                              int positionParentDepth,
                              boolean verifyXpath) {

    public LocatorSettings {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        if (classCombinationMaxSize < 1) {
            throw new IllegalArgumentException("classCombinationMaxSize must be >= 1: " + classCombinationMaxSize);
        }
        if (textSelectorMaxLength < 0 || xpathTextMaxLength < 0 || classMaxCount < 0 || positionParentDepth < 0) {
            throw new IllegalArgumentException("Lengths and counts must not be negative");
        }
    }

    public static LocatorSettings defaults() {
        return new LocatorSettings(10, 50, 100, 6, 3, 3, true);
    }

    public LocatorSettings withVerifyXpath(boolean verify) {
        return new LocatorSettings(maxDepth, textSelectorMaxLength, xpathTextMaxLength,
                classMaxCount, classCombinationMaxSize, positionParentDepth, verify);
    }

    public LocatorSettings withMaxDepth(int depth) {
        return new LocatorSettings(depth, textSelectorMaxLength, xpathTextMaxLength,
                classMaxCount, classCombinationMaxSize, positionParentDepth, verifyXpath);
    }
}

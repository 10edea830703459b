package domlocator.model;

/**
 * Semantic role of an element within the page, resolved from keyword tables.
 * {@link #UNKNOWN} is the explicit "not resolved" value.
 */
public enum SemanticType {

    // Navigation
    PRIMARY_NAV,
    SECONDARY_NAV,
    BREADCRUMB,
    PAGINATION,

    // Content areas
    MAIN_CONTENT,
    SIDEBAR,
    RELATED_CONTENT,
    COMMENTS,
    REVIEWS,

    // Forms and actions
    SEARCH_FORM,
    LOGIN_FORM,
    REGISTRATION_FORM,
    CONTACT_FORM,
    CHECKOUT_FORM,

    // UI components
    MODAL,
    DROPDOWN,
    TABS,
    ACCORDION,
    CAROUSEL,
    TOOLTIP,
    ALERT,

    // E-commerce
    PRODUCT_LISTING,
    PRODUCT_DETAILS,
    CART,
    WISHLIST,

    ADVERTISEMENT,
    SOCIAL_MEDIA,
    COOKIE_BANNER,
    UNKNOWN;

    public boolean isResolved() {
        return this != UNKNOWN;
    }
}

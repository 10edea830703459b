package domlocator.classify;

import domlocator.model.SemanticType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Keyword tables used to resolve {@link SemanticType}s.
 *
 * <p>Resolution order is fixed: search keywords, then login keywords, then
 * the {@code nav} tag or nav keywords, then the generic table in insertion
 * order. Keywords are stored lower-case and matched as substrings.
 *
 * <p>Instances are immutable; {@link #withKeywords} returns a copy.
 */
public final class SemanticRules {

    private final List<String> search;
    private final List<String> login;
    private final List<String> navigation;
    private final Map<SemanticType, List<String>> generic;

    private SemanticRules(List<String> search,
                          List<String> login,
                          List<String> navigation,
                          Map<SemanticType, List<String>> generic) {
        this.search     = normalise(search);
        this.login      = normalise(login);
        this.navigation = normalise(navigation);
        Map<SemanticType, List<String>> copy = new LinkedHashMap<>();
        generic.forEach((type, words) -> copy.put(type, normalise(words)));
        this.generic    = Collections.unmodifiableMap(copy);
    }

    public static SemanticRules defaults() {
        Map<SemanticType, List<String>> generic = new LinkedHashMap<>();
        generic.put(SemanticType.REGISTRATION_FORM, List.of("register", "sign up", "signup", "create account"));
        generic.put(SemanticType.CONTACT_FORM,      List.of("contact", "message", "feedback", "inquiry"));
        generic.put(SemanticType.CHECKOUT_FORM,     List.of("checkout", "payment", "billing", "purchase"));
        generic.put(SemanticType.CART,              List.of("cart", "basket", "bag", "shopping"));
        generic.put(SemanticType.WISHLIST,          List.of("wishlist", "favorites", "saved", "bookmark"));
        generic.put(SemanticType.SOCIAL_MEDIA,      List.of("share", "like", "follow", "tweet", "facebook", "twitter"));
        generic.put(SemanticType.ADVERTISEMENT,     List.of("ad", "advertisement", "sponsor", "promoted"));
        generic.put(SemanticType.COOKIE_BANNER,     List.of("cookie", "privacy", "accept", "consent"));
        return new SemanticRules(
                List.of("search", "query", "find"),
                List.of("login", "signin", "sign-in", "auth", "user"),
                List.of("nav", "menu", "header", "breadcrumb"),
                generic);
    }

    /**
     * Returns a copy with the keyword list for {@code type} replaced.
     * {@code SEARCH_FORM}, {@code LOGIN_FORM} and {@code PRIMARY_NAV} replace the
     * corresponding precedence rule; any other type replaces (or appends) its
     * entry in the generic table.
     */
    public SemanticRules withKeywords(SemanticType type, List<String> keywords) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(keywords, "keywords");
        switch (type) {
            case SEARCH_FORM: return new SemanticRules(keywords, login, navigation, generic);
            case LOGIN_FORM:  return new SemanticRules(search, keywords, navigation, generic);
            case PRIMARY_NAV: return new SemanticRules(search, login, keywords, generic);
            case UNKNOWN:     throw new IllegalArgumentException("UNKNOWN has no keywords");
            default:
                Map<SemanticType, List<String>> copy = new LinkedHashMap<>(generic);
                copy.put(type, keywords);
                return new SemanticRules(search, login, navigation, copy);
        }
    }

    public List<String> searchKeywords()     { return search; }
    public List<String> loginKeywords()      { return login; }
    public List<String> navigationKeywords() { return navigation; }

    /** Generic keyword table, in resolution order. */
    public Map<SemanticType, List<String>> genericKeywords() { return generic; }

    private static List<String> normalise(List<String> words) {
        return words.stream()
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .filter(w -> !w.isEmpty())
                .distinct()
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticRules)) return false;
        SemanticRules that = (SemanticRules) o;
        return search.equals(that.search) && login.equals(that.login)
                && navigation.equals(that.navigation) && generic.equals(that.generic);
    }

    @Override
    public int hashCode() {
        return Objects.hash(search, login, navigation, generic);
    }
}

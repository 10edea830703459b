package domlocator.classify;

import domlocator.model.AccessibilityRole;
import domlocator.model.ElementType;
import domlocator.model.FormFieldType;
import domlocator.model.InteractionType;
import domlocator.model.SemanticType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the classifier derives from a single element, before locators
 * and an id are attached.
 *
 * @param elementType      tag-derived type with the {@code input} override applied
 * @param interactions     possible interactions, in enum order
 * @param formFieldType    {@code null} when not a form control
 * @param semanticType     {@link SemanticType#UNKNOWN} when unresolved
 * @param confidence       in [0, 1]
 * @param text             whitespace-normalised descendant text
 * @param interactionHints human-readable hints, possibly empty
 * @param properties       tag-specific facts, insertion-ordered
 * @param visible          false when a hiding attribute or inline style is present
 * @param enabled          false for {@code disabled} or {@code aria-disabled="true"}
 * @param role             recognised {@code role} attribute, or {@code null}
 */
public record Classification(ElementType elementType,
                             Set<InteractionType> interactions,
                             FormFieldType formFieldType,
                             SemanticType semanticType,
                             double confidence,
                             String text,
                             List<String> interactionHints,
                             Map<String, Object> properties,
                             boolean visible,
                             boolean enabled,
                             AccessibilityRole role) {

    public Classification {
        interactions = interactions.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(interactions));
        interactionHints = List.copyOf(interactionHints);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}

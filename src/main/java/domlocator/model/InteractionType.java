package domlocator.model;

/** Kinds of interaction an automation driver may perform on an element. */
public enum InteractionType {
    CLICK,
    TYPE,
    SELECT,
    HOVER,
    SCROLL,
    DRAG,
    DROP,
    FOCUS,
    BLUR,
    SUBMIT,
    UPLOAD,
    DOWNLOAD,
    NAVIGATE,
    MULTI_SELECT,
    DATE_PICK,
    COLOR_PICK,
    RANGE_SELECT
}

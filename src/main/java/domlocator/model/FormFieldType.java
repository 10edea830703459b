package domlocator.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/** Expected input of a form control. */
public enum FormFieldType {

    TEXT, EMAIL, PASSWORD, PHONE, URL, SEARCH,
    NUMBER, RANGE,
    DATE, TIME, DATETIME, MONTH, WEEK,
    SELECT, MULTISELECT, RADIO, CHECKBOX,
    FILE, IMAGE,
    COLOR, HIDDEN, TEXTAREA,
    SUBMIT, RESET, BUTTON;

    private static final Map<String, FormFieldType> BY_INPUT_TYPE = Map.ofEntries(
            entry("text", TEXT),
            entry("email", EMAIL),
            entry("password", PASSWORD),
            entry("tel", PHONE),
            entry("url", URL),
            entry("search", SEARCH),
            entry("number", NUMBER),
            entry("range", RANGE),
            entry("date", DATE),
            entry("time", TIME),
            entry("datetime-local", DATETIME),
            entry("month", MONTH),
            entry("week", WEEK),
            entry("radio", RADIO),
            entry("checkbox", CHECKBOX),
            entry("file", FILE),
            entry("color", COLOR),
            entry("hidden", HIDDEN),
            entry("submit", SUBMIT),
            entry("reset", RESET),
            entry("button", BUTTON));

    /**
     * Maps an {@code <input type="...">} value. Unrecognised types (including
     * {@code image}, which browsers treat as a graphical submit) map to empty.
     */
    public static Optional<FormFieldType> forInputType(String inputType) {
        if (inputType == null) return Optional.empty();
        return Optional.ofNullable(BY_INPUT_TYPE.get(inputType.trim().toLowerCase(Locale.ROOT)));
    }
}

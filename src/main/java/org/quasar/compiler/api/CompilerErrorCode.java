package org.quasar.compiler.api;

/**
 * Defines unique, testable error codes for all semantic errors.
 * This decouples the test logic from the wording of the error messages.
 */
public enum CompilerErrorCode {
    // region Scope & Binding Errors
    /** A name was used that is not declared in any enclosing scope. */
    UNDECLARED_IDENTIFIER("E0001"),
    /** A name was declared twice in the same scope. */
    REDECLARATION("E0002"),
    /** A constant or function was assigned to. */
    CONST_REASSIGNMENT("E0003"),
    /** A reserved built-in namespace name was declared. */
    RESERVED_IDENTIFIER("E0205"),
    // endregion

    // region Type Errors
    /** A value does not have the declared type. */
    TYPE_MISMATCH("E0100"),
    /** An if or while condition is not bool. */
    NON_BOOL_CONDITION("E0101"),
    /** Arithmetic, comparison or negation operands have invalid types. */
    INVALID_OPERANDS("E0102"),
    /** Strings were compared with a relational operator. */
    STRING_COMPARISON("E0103"),
    /** A logical operand is not bool, or a literal zero divisor was found. */
    INVALID_LOGICAL_OPERAND("E0104"),
    // endregion

    // region Control Flow Errors
    /** A break outside of any loop. */
    BREAK_OUTSIDE_LOOP("E0200"),
    /** A continue outside of any loop. */
    CONTINUE_OUTSIDE_LOOP("E0201"),
    /** A function was called with the wrong number of arguments. */
    ARGUMENT_COUNT_MISMATCH("E0300"),
    /** A function argument does not have the parameter's type. */
    ARGUMENT_TYPE_MISMATCH("E0301"),
    /** A returned value does not have the function's return type. */
    RETURN_TYPE_MISMATCH("E0302"),
    /** A non-void function can finish without returning. */
    MISSING_RETURN("E0303"),
    /** A return at top level. */
    RETURN_OUTSIDE_FUNCTION("E0304"),
    // endregion

    // region Print Errors
    /** The sep argument of print is not str. */
    PRINT_SEP_NOT_STR("E0402"),
    /** The end argument of print is not str. */
    PRINT_END_NOT_STR("E0403"),
    /** A format string has more placeholders than arguments. */
    FORMAT_TOO_FEW_ARGUMENTS("E0410"),
    /** A format string has fewer placeholders than arguments. */
    FORMAT_TOO_MANY_ARGUMENTS("E0411"),
    // endregion

    // region List & Built-in Function Errors
    /** A list literal mixes element types. */
    HETEROGENEOUS_LIST("E0500"),
    /** A list index is not int. */
    INDEX_NOT_INT("E0501"),
    /** A value that is neither a list nor a dict was indexed. */
    NOT_INDEXABLE("E0502"),
    /** A list element assignment has the wrong type. */
    ELEMENT_TYPE_MISMATCH("E0503"),
    /** A range bound is not int. */
    RANGE_BOUND_NOT_INT("E0504"),
    /** A for loop iterates over something that is neither a range nor a list. */
    NOT_ITERABLE("E0505"),
    /** Misuse of push(). */
    PUSH_ERROR("E0506"),
    /** Misuse of len(). */
    LEN_ERROR("E0507"),
    /** input() with more than one argument. */
    INPUT_ARGUMENT_COUNT("E0600"),
    /** input() with a prompt that is not str. */
    INPUT_PROMPT_NOT_STR("E0601"),
    /** A cast with other than exactly one argument. */
    CAST_ARGUMENT_COUNT("E0602"),
    // endregion

    // region Struct Errors
    /** A struct name was declared twice. */
    DUPLICATE_STRUCT("E0800"),
    /** A struct declares the same field twice. */
    DUPLICATE_FIELD("E0801"),
    /** A type annotation names no known struct or enum. */
    UNKNOWN_TYPE("E0802"),
    /** A struct literal names an undefined struct. */
    UNDEFINED_STRUCT("E0803"),
    /** A struct literal leaves fields uninitialized. */
    MISSING_FIELDS("E0804"),
    /** A struct literal initializes a field the struct does not have. */
    UNKNOWN_FIELD_IN_INIT("E0805"),
    /** A struct literal field value has the wrong type. */
    FIELD_INIT_TYPE_MISMATCH("E0806"),
    /** A member was accessed on a value that is not a struct. */
    MEMBER_ACCESS_ON_NON_STRUCT("E0807"),
    /** A field was read or written that the struct does not have. */
    UNKNOWN_FIELD("E0808"),
    /** A field write has the wrong type. */
    FIELD_ASSIGN_TYPE_MISMATCH("E0809"),
    // endregion

    // region Import Errors
    /** The same module was imported twice. */
    DUPLICATE_IMPORT("E0900"),
    /** A local module file does not exist. */
    MODULE_NOT_FOUND("E0901"),
    // endregion

    // region Dict Errors
    /** A dict literal mixes key types. */
    HETEROGENEOUS_DICT_KEYS("E1000"),
    /** A dict literal mixes value types. */
    HETEROGENEOUS_DICT_VALUES("E1001"),
    /** A dict key type is not hashable. */
    UNHASHABLE_KEY("E1002"),
    /** A dict was indexed with a key of the wrong type. */
    KEY_TYPE_MISMATCH("E1003"),
    /** A dict entry assignment has the wrong value type. */
    DICT_VALUE_TYPE_MISMATCH("E1004"),
    /** keys() was called on something that is not a dict. */
    KEYS_ARGUMENT_NOT_DICT("E1005"),
    /** values() was called on something that is not a dict. */
    VALUES_ARGUMENT_NOT_DICT("E1006"),
    // endregion

    // region Method Errors
    /** A method argument does not match the container's element, key or value type. */
    GENERIC_ARGUMENT_MISMATCH("E1100"),
    /** join() was called on a list that is not [str]. */
    JOIN_REQUIRES_STR_LIST("E1102"),
    /** The receiver type has no method of that name. */
    UNKNOWN_METHOD("E1105"),
    /** A method was called with the wrong number of arguments. */
    METHOD_ARGUMENT_COUNT("E1106"),
    /** A method argument has the wrong fixed type. */
    METHOD_ARGUMENT_TYPE("E1107"),
    // endregion

    // region Enum Errors
    /** A type name was declared twice (enum/enum or enum/struct). */
    DUPLICATE_TYPE("E1200"),
    /** An enum declares the same variant twice. */
    DUPLICATE_VARIANT("E1201"),
    /** An enum has no variant of that name. */
    UNKNOWN_VARIANT("E1202"),
    /** An enum was compared with a value of another type. */
    ENUM_COMPARISON_MISMATCH("E1204"),
    /** A relational operator was applied to enum values. */
    ENUM_RELATIONAL_OPERATOR("E1205");
    // endregion

    private final String code;

    CompilerErrorCode(String code) {
        this.code = code;
    }

    /**
     * @return The stable code, e.g. {@code "E0001"}.
     */
    public String code() {
        return code;
    }
}

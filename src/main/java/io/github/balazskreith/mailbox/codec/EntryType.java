package io.github.balazskreith.mailbox.codec;

public enum EntryType {

    /**
     * A request to invoke a procedure, appended by a correlator
     */
    CALL("call"),

    /**
     * The outcome of exactly one call, appended by a dispatcher
     */
    RESPONSE("response"),

    /**
     * An entry of a type this version does not know
     */
    UNKNOWN(null),
    ;

    private final String wireName;

    EntryType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return this.wireName;
    }

    public static EntryType fromWireName(String name) {
        for (var type : values()) {
            if (type.wireName != null && type.wireName.equals(name)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}

package com.contrastsecurity.depupdate.exception;

/**
 * Exception thrown when no registry version satisfies the range declared in package.json.
 */
public class UnresolvableRangeException extends UpdateException {

    private final String packageName;
    private final String range;

    public UnresolvableRangeException(String packageName, String range, String message) {
        super(message);
        this.packageName = packageName;
        this.range = range;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getRange() {
        return range;
    }
}

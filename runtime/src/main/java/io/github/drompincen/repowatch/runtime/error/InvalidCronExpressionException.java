package io.github.drompincen.repowatch.runtime.error;

public class InvalidCronExpressionException extends RepoWatchException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String getExpression() { return expression; }
}

package com.boxoffice.theatre;

/**
 * <p>
 * Generic interface for the
 * <a href="https://en.wikipedia.org/wiki/Command_pattern">command pattern</a>.
 * </p>
 *
 * <p>
 * Every message exchanged between the actors of the theatre is a command
 * executed on the receiving actor.
 * </p>
 *
 * @param <A> Actor type to execute the command on.
 */
public interface Command<A> {
    /**
     * Executes the command on the provided actor.
     *
     * @param actor Actor to execute the command on.
     */
    void execute(A actor);
}

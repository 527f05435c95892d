// Part of Current
package com.machinezoo.current;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/**
 * Snapshot of a computation's output, which is either a successful result, an error message, or pending.
 * {@code Output} is immutable.
 * <p>
 * Pending output means the value is not available yet. It is not an error.
 * Error output carries human-readable diagnostic that is passed on to whoever consumes the output.
 * Recoverable conditions are always represented as {@code Output} instead of being thrown.
 *
 * @param <T>
 *            type of the successful result
 *
 * @see Input
 * @see Snapshot
 */
@DraftDocs("link to pipeline docs")
public class Output<T> {
	private enum Kind {
		OK, ERROR, PENDING
	}
	private final Kind kind;
	private final T result;
	private final String error;
	private Output(Kind kind, T result, String error) {
		this.kind = kind;
		this.result = result;
		this.error = error;
	}
	private static final Output<?> pending = new Output<>(Kind.PENDING, null, null);
	/**
	 * Creates successful output. The result may be {@code null}.
	 *
	 * @param <T>
	 *            type of the result
	 * @param result
	 *            result of the computation
	 * @return successful output carrying the {@code result}
	 */
	public static <T> Output<T> ok(T result) {
		return new Output<>(Kind.OK, result, null);
	}
	/**
	 * Creates error output.
	 *
	 * @param <T>
	 *            type of the result the failed computation would have produced
	 * @param message
	 *            human-readable description of the error
	 * @return error output carrying the {@code message}
	 * @throws NullPointerException
	 *             if {@code message} is {@code null}
	 */
	public static <T> Output<T> error(String message) {
		Objects.requireNonNull(message);
		return new Output<>(Kind.ERROR, null, message);
	}
	/**
	 * Returns pending output, which signals that the value has not been computed yet.
	 *
	 * @param <T>
	 *            type of the result that will be eventually available
	 * @return pending output
	 */
	@SuppressWarnings("unchecked")
	public static <T> Output<T> pending() {
		return (Output<T>)pending;
	}
	public boolean isOk() {
		return kind == Kind.OK;
	}
	public boolean isError() {
		return kind == Kind.ERROR;
	}
	public boolean isPending() {
		return kind == Kind.PENDING;
	}
	/**
	 * Returns the successful result.
	 *
	 * @return the result or {@code null} if this output is not successful
	 */
	public T result() {
		return result;
	}
	/**
	 * Returns error message.
	 *
	 * @return the message or {@code null} if this is not an error output
	 */
	public String error() {
		return error;
	}
	/**
	 * Transforms successful result. Error and pending outputs are passed through unchanged.
	 *
	 * @param <R>
	 *            type of the transformed result
	 * @param mapping
	 *            function applied to the result
	 * @return output carrying the transformed result or this output if it is not successful
	 */
	@SuppressWarnings("unchecked")
	public <R> Output<R> map(Function<? super T, ? extends R> mapping) {
		Objects.requireNonNull(mapping);
		if (kind != Kind.OK)
			return (Output<R>)this;
		return ok(mapping.apply(result));
	}
	/**
	 * Compares this output with another output using specified equality for successful results.
	 * Two errors are equal if their messages are equal. Pending output is only equal to pending output.
	 *
	 * @param other
	 *            output to compare with
	 * @param equality
	 *            equality test applied when both outputs are successful
	 * @return {@code true} if the two outputs are considered equal
	 */
	public boolean equals(Output<T> other, BiPredicate<? super T, ? super T> equality) {
		Objects.requireNonNull(other);
		Objects.requireNonNull(equality);
		if (kind != other.kind)
			return false;
		switch (kind) {
			case OK:
				return equality.test(result, other.result);
			case ERROR:
				return error.equals(other.error);
			default:
				return true;
		}
	}
	@Override
	@SuppressWarnings("unchecked")
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Output))
			return false;
		return equals((Output<T>)obj, Objects::equals);
	}
	@Override
	public int hashCode() {
		return Objects.hash(kind, result, error);
	}
	@Override
	public String toString() {
		switch (kind) {
			case OK:
				return "Ok(" + result + ")";
			case ERROR:
				return "Error(" + error + ")";
			default:
				return "Pending";
		}
	}
}

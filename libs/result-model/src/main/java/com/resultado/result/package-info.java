/**
 * Structured operation outcomes.
 *
 * <h2>Sealed Interface</h2>
 *
 * <ul>
 *   <li>{@link com.resultado.result.Result} - permits {@link com.resultado.result.Success} and
 *       {@link com.resultado.result.Failure}
 * </ul>
 *
 * <h2>Vocabulary</h2>
 *
 * <ul>
 *   <li>{@link com.resultado.result.Kind} - outcome category, split into a success and a failure
 *       range
 *   <li>{@link com.resultado.result.ValidationError} - one field-level problem, optionally
 *       carrying a JSON Pointer to the offending member
 *   <li>{@link com.resultado.result.ValidationSeverity} - severity flags of a validation error
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Result<Order> result = balance < price
 *         ? Result.failWithDetail("Not enough credit.", "Balance is 30, price is 50.", Kind.CONFLICT)
 *         : Result.succeed(order, Kind.CREATED);
 *
 * int status = result.match(success -> 201, failure -> 409);
 * }</pre>
 */
package com.resultado.result;

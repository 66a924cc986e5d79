package com.resultado.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("Result")
class ResultTest {

    private record Example(int num) {
        Example() {
            this(2);
        }
    }

    @Nested
    @DisplayName("kind ranges")
    class KindRanges {

        @ParameterizedTest
        @EnumSource(
                value = Kind.class,
                names = {"OK", "CREATED", "NO_CONTENT", "ACCEPTED"})
        @DisplayName("success accepts every success-range kind")
        void successAcceptsSuccessKinds(Kind kind) {
            assertThat(Result.succeed("value", kind).kind()).isEqualTo(kind);
            assertThat(Result.succeed().withKind(kind).kind()).isEqualTo(kind);
        }

        @ParameterizedTest
        @EnumSource(
                value = Kind.class,
                names = {"OK", "CREATED", "NO_CONTENT", "ACCEPTED"},
                mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("success rejects every failure-range kind")
        void successRejectsFailureKinds(Kind kind) {
            assertThatThrownBy(() -> Result.succeed().withKind(kind))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Cannot set non-success status to a success result.");
            assertThatThrownBy(() -> Result.succeed(new Example(), kind))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Cannot set non-success status to a success result.");
        }

        @ParameterizedTest
        @EnumSource(
                value = Kind.class,
                names = {"OK", "CREATED", "NO_CONTENT", "ACCEPTED"})
        @DisplayName("failure rejects every success-range kind")
        void failureRejectsSuccessKinds(Kind kind) {
            assertThatThrownBy(() -> Result.fail("").withKind(kind))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Cannot set non-error status to a failure result.");
            assertThatThrownBy(() -> Result.fail("Title", "error", kind))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Cannot set non-error status to a failure result.");
        }

        @ParameterizedTest
        @EnumSource(
                value = Kind.class,
                names = {"OK", "CREATED", "NO_CONTENT", "ACCEPTED"},
                mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("failure accepts every failure-range kind")
        void failureAcceptsFailureKinds(Kind kind) {
            assertThat(Result.fail("Title", "error", kind).kind()).isEqualTo(kind);
        }

        @Test
        @DisplayName("null kind falls back to the variant default")
        void nullKindDefaults() {
            assertThat(new Success<>("v", null, null).kind()).isEqualTo(Kind.OK);
            assertThat(new Failure<>("t", null, null, null, null, null).kind())
                    .isEqualTo(Kind.ERROR);
            assertThat(
                            new Failure<>("t", null, null, List.of(ValidationError.of("x")), null, null)
                                    .kind())
                    .isEqualTo(Kind.INVALID);
        }
    }

    @Nested
    @DisplayName("discrimination")
    class Discrimination {

        @Test
        @DisplayName("success and failure are discernible")
        void discernible() {
            Result<String> failure = Result.fail("Some error");
            Result<String> success = Result.succeed("Some success");

            assertThat(failure).isInstanceOf(Failure.class).isNotInstanceOf(Success.class);
            assertThat(success).isInstanceOf(Success.class).isNotInstanceOf(Failure.class);
            assertThat(failure.isFailure()).isTrue();
            assertThat(failure.isSuccess()).isFalse();
            assertThat(success.isSuccess()).isTrue();
            assertThat(success.isFailure()).isFalse();
        }

        @Test
        @DisplayName("match dispatches on the variant")
        void matchDispatches() {
            Result<Example> success = Result.succeed(new Example());
            Result<Example> failure = Result.fail(ValidationError.of("bad"));

            int fromSuccess = success.match(s -> s.value().num(), f -> -1);
            int fromFailure = failure.match(s -> s.value().num(), f -> -1);

            assertThat(fromSuccess).isEqualTo(2);
            assertThat(fromFailure).isEqualTo(-1);
        }

        @Test
        @DisplayName("value is accessible through the success variant")
        void valueAccessible() {
            Result<Example> result = Result.succeed(new Example());

            assertThat(result).isInstanceOf(Success.class);
            assertThat(((Success<Example>) result).value().num()).isEqualTo(2);
        }

        @Test
        @DisplayName("success may carry a null value")
        void nullValue() {
            Success<Integer> result = Result.succeed((Integer) null);

            assertThat(result.value()).isNull();
            assertThat(result.kind()).isEqualTo(Kind.OK);
        }
    }

    @Nested
    @DisplayName("success factories")
    class SuccessFactories {

        @Test
        @DisplayName("succeed() has neither value nor message")
        void bareSuccess() {
            var success = Result.succeed();

            assertThat(success.value()).isNull();
            assertThat(success.message()).isNull();
            assertThat(success.kind()).isEqualTo(Kind.OK);
        }

        @Test
        @DisplayName("succeedWithMessage carries the message and kind")
        void messageSuccess() {
            var success = Result.succeedWithMessage("Order cancelled", Kind.ACCEPTED);

            assertThat(success.message()).isEqualTo("Order cancelled");
            assertThat(success.kind()).isEqualTo(Kind.ACCEPTED);
        }

        @Test
        @DisplayName("succeed(value, message, kind) keeps all three")
        void fullSuccess() {
            var success = Result.succeed(42, "answer", Kind.CREATED);

            assertThat(success.value()).isEqualTo(42);
            assertThat(success.message()).isEqualTo("answer");
            assertThat(success.kind()).isEqualTo(Kind.CREATED);
        }

        @Test
        @DisplayName("withMessage leaves value and kind")
        void withMessage() {
            var success = Result.succeed("v", Kind.CREATED).withMessage("done");

            assertThat(success.value()).isEqualTo("v");
            assertThat(success.kind()).isEqualTo(Kind.CREATED);
            assertThat(success.message()).isEqualTo("done");
        }
    }

    @Nested
    @DisplayName("failure factories")
    class FailureFactories {

        @Test
        @DisplayName("title and error")
        void titleAndError() {
            Failure<Object> failure = Result.fail("Payment failed", "Card declined");

            assertThat(failure.title()).isEqualTo("Payment failed");
            assertThat(failure.errors()).containsExactly("Card declined");
            assertThat(failure.kind()).isEqualTo(Kind.ERROR);
        }

        @Test
        @DisplayName("error list has an empty title")
        void errorList() {
            Failure<Object> failure = Result.fail("Error 1", "Error 2", "Error 3");

            assertThat(failure.title()).isEmpty();
            assertThat(failure.errors()).containsExactly("Error 1", "Error 2", "Error 3");
            assertThat(failure.validationErrors()).isEmpty();
        }

        @Test
        @DisplayName("two strings are title and error")
        void twoStrings() {
            Failure<Object> failure = Result.fail("Error 1", "Error 2");

            assertThat(failure.title()).isEqualTo("Error 1");
            assertThat(failure.errors()).containsExactly("Error 2");
        }

        @Test
        @DisplayName("collection of errors is stored verbatim")
        void errorCollection() {
            Failure<Object> failure = Result.fail(List.of("b", "a", "b"));

            assertThat(failure.errors()).containsExactly("b", "a", "b");
        }

        @Test
        @DisplayName("failWithDetail keeps the detail and has no errors")
        void withDetail() {
            Failure<Object> failure =
                    Result.failWithDetail(
                            "You do not have enough credit.",
                            "Your current balance is 30, but that costs 50.",
                            Kind.CONFLICT);

            assertThat(failure.detail()).isEqualTo("Your current balance is 30, but that costs 50.");
            assertThat(failure.errors()).isEmpty();
            assertThat(failure.kind()).isEqualTo(Kind.CONFLICT);
        }

        @Test
        @DisplayName("validation errors always give INVALID")
        void validationIsInvalid() {
            Failure<Object> single = Result.fail(new ValidationError("Some error"));
            Failure<Object> titled =
                    Result.failValidation("Bad input", ValidationError.of("a"), ValidationError.of("b"));
            Failure<Object> collected =
                    Result.failValidation(List.of(ValidationError.of("a")));

            assertThat(single.kind()).isEqualTo(Kind.INVALID);
            assertThat(titled.kind()).isEqualTo(Kind.INVALID);
            assertThat(titled.title()).isEqualTo("Bad input");
            assertThat(collected.kind()).isEqualTo(Kind.INVALID);
            assertThat(collected.title()).isEmpty();
        }
    }

    @Nested
    @DisplayName("map")
    class Mapping {

        @Test
        @DisplayName("maps a success value and keeps message and kind")
        void mapsSuccess() {
            Result<Integer> result = Result.succeed("abc", "note", Kind.CREATED).map(String::length);

            assertThat(result).isEqualTo(new Success<>(3, "note", Kind.CREATED));
        }

        @Test
        @DisplayName("passes a failure through")
        void passesFailure() {
            Result<String> failure = Result.fail("Title", "oops", Kind.NOT_FOUND);

            Result<Integer> mapped = failure.map(String::length);

            assertThat(mapped).isInstanceOf(Failure.class);
            assertThat(mapped.kind()).isEqualTo(Kind.NOT_FOUND);
            assertThat(((Failure<Integer>) mapped).errors()).containsExactly("oops");
        }
    }
}

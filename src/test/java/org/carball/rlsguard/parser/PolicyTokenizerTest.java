package org.carball.rlsguard.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PolicyTokenizerTest {

    @Test
    void shouldKeepQuotedRegionAsSingleToken() {
        // When
        List<Token> tokens = new PolicyTokenizer("status = 'not = (this)'").tokenize();

        // Then
        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.WORD, TokenType.OPERATOR, TokenType.QUOTED);
        assertThat(tokens.get(2).text()).isEqualTo("'not = (this)'");
    }

    @Test
    void shouldSplitPunctuationIntoSingleCharacterTokens() {
        // When
        List<Token> tokens = new PolicyTokenizer("a<=b").tokenize();

        // Then
        assertThat(tokens).extracting(Token::text).containsExactly("a", "<", "=", "b");
        assertThat(tokens.get(1).isFollowedBy(tokens.get(2))).isTrue();
    }

    @Test
    void shouldRecordTokenPositions() {
        // When
        List<Token> tokens = new PolicyTokenizer("auth.uid() = user_id").tokenize();

        // Then
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.WORD, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.OPERATOR, TokenType.WORD);
        assertThat(tokens).extracting(Token::position).containsExactly(0, 8, 9, 11, 13);
    }

    @Test
    void shouldKeepEscapedQuotesInsideLiteral() {
        // When
        List<Token> doubled = new PolicyTokenizer("name = 'O''Brien'").tokenize();
        List<Token> escapeString = new PolicyTokenizer("name = E'it\\'s'").tokenize();

        // Then
        assertThat(doubled).hasSize(3);
        assertThat(doubled.get(2).text()).isEqualTo("'O''Brien'");
        assertThat(escapeString).hasSize(3);
        assertThat(escapeString.get(2).type()).isEqualTo(TokenType.QUOTED);
        assertThat(escapeString.get(2).text()).isEqualTo("E'it\\'s'");
        assertThat(escapeString.get(2).position()).isEqualTo(7);
    }

    @Test
    void shouldTreatBackslashAsPlainCharacterOutsideEscapeStrings() {
        // When
        List<Token> tokens = new PolicyTokenizer("name = 'C:\\' AND x = 1").tokenize();

        // Then
        assertThat(tokens).extracting(Token::text)
                .containsExactly("name", "=", "'C:\\'", "AND", "x", "=", "1");
    }

    @Test
    void shouldSplitArrayBrackets() {
        // When
        List<Token> tokens = new PolicyTokenizer("ARRAY['a'::text]").tokenize();

        // Then
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.WORD, TokenType.LEFT_BRACKET, TokenType.QUOTED, TokenType.WORD, TokenType.RIGHT_BRACKET);
    }

    @Test
    void shouldHandleDoubleQuotedIdentifiers() {
        // When
        List<Token> tokens = new PolicyTokenizer("\"Owner Id\" = auth.uid()").tokenize();

        // Then
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.QUOTED);
        assertThat(tokens.get(0).text()).isEqualTo("\"Owner Id\"");
    }

    @Test
    void shouldRejectUnterminatedQuote() {
        // When/Then
        assertThatThrownBy(() -> new PolicyTokenizer("name = 'abc").tokenize())
                .isInstanceOf(PolicyParseException.class)
                .hasMessageContaining("Unterminated quoted literal")
                .extracting(e -> ((PolicyParseException) e).getPosition())
                .isEqualTo(7);
    }

    @Test
    void shouldReturnNoTokensForBlankInput() {
        assertThat(new PolicyTokenizer("   ").tokenize()).isEmpty();
    }
}

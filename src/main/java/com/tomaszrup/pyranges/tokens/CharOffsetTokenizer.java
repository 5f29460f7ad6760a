////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pyranges.tokens;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

import com.tomaszrup.pyranges.text.SourceDecodingException;
import com.tomaszrup.pyranges.text.SourceLines;

/**
 * Wraps a {@link TokenSource} and re-expresses its byte columns as
 * character columns, so that token positions can be compared with text
 * offsets directly.
 */
public class CharOffsetTokenizer {
	private final TokenSource tokenSource;
	private final Charset defaultCharset;

	public CharOffsetTokenizer(TokenSource tokenSource, Charset defaultCharset) {
		this.tokenSource = tokenSource;
		this.defaultCharset = defaultCharset;
	}

	/**
	 * @throws SourceDecodingException if a token column splits an encoded
	 *                                 character or the source names an
	 *                                 unknown encoding
	 */
	public List<Token> tokenize(String source) {
		return toCharOffsets(tokenSource.generateTokens(source), SourceLines.of(source));
	}

	List<Token> toCharOffsets(List<Token> byteTokens, SourceLines lines) {
		Charset charset = defaultCharset;
		List<Token> result = new ArrayList<>(byteTokens.size());
		for (Token token : byteTokens) {
			if (token.getType() == TokenType.ENCODING) {
				charset = EncodingDetector.charsetFor(token.getString());
			}
			if (token.getStart().getLine() == 0
					|| (token.getStart().getColumn() == 0 && token.getEnd().getColumn() == 0)) {
				result.add(token);
				continue;
			}
			int startLine = token.getStart().getLine();
			int endLine = token.getEnd().getLine();
			result.add(new Token(token.getType(), token.getString(),
					startLine, lines.toCharColumn(startLine, token.getStart().getColumn(), charset),
					endLine, lines.toCharColumn(endLine, token.getEnd().getColumn(), charset)));
		}
		return result;
	}
}

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
package com.tomaszrup.pyranges;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pyranges.ast.Node;
import com.tomaszrup.pyranges.compiler.EndPositionReconstructor;
import com.tomaszrup.pyranges.compiler.PositionCorrector;
import com.tomaszrup.pyranges.compiler.ReconstructionReport;
import com.tomaszrup.pyranges.text.SourceLines;
import com.tomaszrup.pyranges.tokens.CharOffsetTokenizer;
import com.tomaszrup.pyranges.tokens.EncodingDetector;
import com.tomaszrup.pyranges.tokens.PythonTokenizer;
import com.tomaszrup.pyranges.tokens.Token;
import com.tomaszrup.pyranges.tokens.TokenSource;
import com.tomaszrup.pyranges.util.MdcSourceContext;

/**
 * Gives every positioned node of a Python syntax tree an exact range in
 * character coordinates.
 *
 * <p>Instances hold no per-call state and may be shared between threads as
 * long as each call works on its own tree.</p>
 */
public class TextRangeService {
	private static final Logger logger = LoggerFactory.getLogger(TextRangeService.class);

	private static final String BOM = "\uFEFF";
	private static final String UNKNOWN_FILENAME = "<unknown>";

	private final PythonParser parser;
	private final CharOffsetTokenizer tokenizer;
	private final PositionCorrector corrector;
	private final EndPositionReconstructor reconstructor;

	/**
	 * A service that only marks trees produced elsewhere.
	 */
	public TextRangeService() {
		this(null, RangeOptions.DEFAULT);
	}

	public TextRangeService(PythonParser parser, RangeOptions options) {
		this(parser, new PythonTokenizer(options.getDefaultEncoding()), options);
	}

	public TextRangeService(PythonParser parser, TokenSource tokenSource, RangeOptions options) {
		this.parser = parser;
		this.tokenizer = new CharOffsetTokenizer(tokenSource,
				EncodingDetector.charsetFor(options.getDefaultEncoding()));
		this.corrector = new PositionCorrector(EncodingDetector.charsetFor(options.getParserEncoding()));
		this.reconstructor = new EndPositionReconstructor(options.isWarnOnDegenerateRanges());
	}

	/**
	 * Parses the source with the configured parser and marks the ranges of
	 * the resulting tree.
	 *
	 * @throws IllegalStateException if the service was created without a
	 *                               parser
	 */
	public Node parseSource(String source, String filename, String mode) {
		if (parser == null) {
			throw new IllegalStateException("No Python parser configured");
		}
		Node root = parser.parse(source, filename, mode);
		markTextRanges(root, source, filename);
		return root;
	}

	public ReconstructionReport markTextRanges(Node tree, String source) {
		return markTextRanges(tree, source, UNKNOWN_FILENAME);
	}

	/**
	 * Corrects the start positions of the tree's nodes and sets their end
	 * positions. The tree must still carry the positions its parser
	 * reported, so each tree is marked once.
	 *
	 * @param tree   a tree parsed from {@code source}
	 * @param source the text the tree was parsed from
	 * @return per-node outcomes; nodes whose tokens could not be matched get
	 *         a one-column range and are listed as degenerate
	 */
	public ReconstructionReport markTextRanges(Node tree, String source, String filename) {
		Map<String, String> previousContext = MdcSourceContext.snapshot();
		MdcSourceContext.setSource(filename);
		try {
			String text = source.startsWith(BOM) ? source.substring(BOM.length()) : source;
			SourceLines lines = SourceLines.of(text);
			List<Token> tokens = tokenizer.tokenize(text);
			corrector.correct(tree, lines, tokens);
			ReconstructionReport report = reconstructor.reconstruct(tree, tokens, lines.getEndPosition());
			if (!report.isComplete()) {
				logger.info("{} of {} nodes got a best-effort range", report.getDegenerateCount(),
						report.getNodeCount());
			}
			return report;
		} finally {
			MdcSourceContext.restore(previousContext);
		}
	}
}

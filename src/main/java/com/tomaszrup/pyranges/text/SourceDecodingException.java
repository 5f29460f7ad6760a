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
package com.tomaszrup.pyranges.text;

import java.nio.charset.Charset;

/**
 * Raised when a byte column cannot be mapped back to a character column
 * because the encoded line prefix is not a valid byte sequence, or when the
 * source declares an encoding the JVM does not know.
 */
public class SourceDecodingException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public SourceDecodingException(String message) {
		super(message);
	}

	public SourceDecodingException(int lineno, int byteColumn, Charset charset, Throwable cause) {
		super("Cannot decode line " + lineno + " up to byte " + byteColumn + " as " + charset.name(), cause);
	}
}

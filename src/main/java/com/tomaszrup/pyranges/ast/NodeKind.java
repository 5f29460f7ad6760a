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
package com.tomaszrup.pyranges.ast;

/**
 * The closed set of Python syntax tree node kinds. Operators and expression
 * contexts are not nodes here; they travel as a node's value.
 */
public enum NodeKind {
	MODULE(Category.MOD),
	INTERACTIVE(Category.MOD),
	EXPRESSION(Category.MOD),

	FUNCTION_DEF(Category.STMT),
	ASYNC_FUNCTION_DEF(Category.STMT),
	CLASS_DEF(Category.STMT),
	RETURN(Category.STMT),
	DELETE(Category.STMT),
	ASSIGN(Category.STMT),
	AUG_ASSIGN(Category.STMT),
	ANN_ASSIGN(Category.STMT),
	FOR(Category.STMT),
	ASYNC_FOR(Category.STMT),
	WHILE(Category.STMT),
	IF(Category.STMT),
	WITH(Category.STMT),
	ASYNC_WITH(Category.STMT),
	RAISE(Category.STMT),
	TRY(Category.STMT),
	ASSERT(Category.STMT),
	IMPORT(Category.STMT),
	IMPORT_FROM(Category.STMT),
	GLOBAL(Category.STMT),
	NONLOCAL(Category.STMT),
	EXPR(Category.STMT),
	PASS(Category.STMT),
	BREAK(Category.STMT),
	CONTINUE(Category.STMT),

	BOOL_OP(Category.EXPR),
	NAMED_EXPR(Category.EXPR),
	BIN_OP(Category.EXPR),
	UNARY_OP(Category.EXPR),
	LAMBDA(Category.EXPR),
	IF_EXP(Category.EXPR),
	DICT(Category.EXPR),
	SET(Category.EXPR),
	LIST_COMP(Category.EXPR),
	SET_COMP(Category.EXPR),
	DICT_COMP(Category.EXPR),
	GENERATOR_EXP(Category.EXPR),
	AWAIT(Category.EXPR),
	YIELD(Category.EXPR),
	YIELD_FROM(Category.EXPR),
	COMPARE(Category.EXPR),
	CALL(Category.EXPR),
	NUM(Category.EXPR),
	STR(Category.EXPR),
	BYTES(Category.EXPR),
	FORMATTED_VALUE(Category.EXPR),
	JOINED_STR(Category.EXPR),
	NAME_CONSTANT(Category.EXPR),
	ELLIPSIS(Category.EXPR),
	CONSTANT(Category.EXPR),
	ATTRIBUTE(Category.EXPR),
	SUBSCRIPT(Category.EXPR),
	STARRED(Category.EXPR),
	NAME(Category.EXPR),
	LIST(Category.EXPR),
	TUPLE(Category.EXPR),

	SLICE(Category.OTHER),
	INDEX(Category.OTHER),
	EXT_SLICE(Category.OTHER),
	COMPREHENSION(Category.OTHER),
	EXCEPT_HANDLER(Category.OTHER),
	ARGUMENTS(Category.OTHER),
	ARG(Category.OTHER),
	KEYWORD(Category.OTHER),
	ALIAS(Category.OTHER),
	WITH_ITEM(Category.OTHER);

	public enum Category {
		MOD, STMT, EXPR, OTHER
	}

	private final Category category;

	NodeKind(Category category) {
		this.category = category;
	}

	public Category getCategory() {
		return category;
	}

	public boolean isStatement() {
		return category == Category.STMT;
	}

	public boolean isExpression() {
		return category == Category.EXPR;
	}
}

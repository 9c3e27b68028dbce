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
package com.tomaszrup.phpls.syntax;

/**
 * Phrase (non-terminal) kinds of the PHP parse tree. The child layout noted
 * on a constant is what the symbol reader and the definition provider rely
 * on; trivia tokens may appear anywhere between children and are skipped.
 */
public enum PhraseType {
	/** A span the parser could not make sense of. */
	ERROR,
	/** Root of a file. */
	STATEMENT_LIST,
	/** {@code { statements }} */
	COMPOUND_STATEMENT,
	EXPRESSION_STATEMENT,

	/** {@code namespace NamespaceName? (; | CompoundStatement)} */
	NAMESPACE_DEFINITION,
	/** NAME tokens separated by BACKSLASH tokens. */
	NAMESPACE_NAME,
	/** {@code NamespaceName} */
	QUALIFIED_NAME,
	/** {@code \ NamespaceName} */
	FULLY_QUALIFIED_NAME,
	/** {@code namespace \ NamespaceName} */
	RELATIVE_QUALIFIED_NAME,
	/**
	 * {@code use (function|const)? (NamespaceName \ { NamespaceUseGroupClauseList }
	 * | NamespaceUseClauseList) ;}
	 */
	NAMESPACE_USE_DECLARATION,
	NAMESPACE_USE_CLAUSE_LIST,
	/** {@code NamespaceName NamespaceAliasingClause?} */
	NAMESPACE_USE_CLAUSE,
	NAMESPACE_USE_GROUP_CLAUSE_LIST,
	/** {@code (function|const)? NamespaceName NamespaceAliasingClause?} */
	NAMESPACE_USE_GROUP_CLAUSE,
	/** {@code as NAME} */
	NAMESPACE_ALIASING_CLAUSE,

	/** {@code ClassDeclarationHeader ClassDeclarationBody} */
	CLASS_DECLARATION,
	/** {@code (abstract|final)? class NAME ClassBaseClause? ClassInterfaceClause?} */
	CLASS_DECLARATION_HEADER,
	/** {@code extends QualifiedName} */
	CLASS_BASE_CLAUSE,
	/** {@code implements QualifiedNameList} */
	CLASS_INTERFACE_CLAUSE,
	/** {@code { ClassMemberDeclarationList? }} */
	CLASS_DECLARATION_BODY,
	CLASS_MEMBER_DECLARATION_LIST,
	/** {@code InterfaceDeclarationHeader InterfaceDeclarationBody} */
	INTERFACE_DECLARATION,
	/** {@code interface NAME InterfaceBaseClause?} */
	INTERFACE_DECLARATION_HEADER,
	/** {@code extends QualifiedNameList} */
	INTERFACE_BASE_CLAUSE,
	INTERFACE_DECLARATION_BODY,
	/** {@code TraitDeclarationHeader TraitDeclarationBody} */
	TRAIT_DECLARATION,
	/** {@code trait NAME} */
	TRAIT_DECLARATION_HEADER,
	TRAIT_DECLARATION_BODY,
	/** {@code use QualifiedNameList (; | { adaptations })} */
	TRAIT_USE_CLAUSE,
	/** Qualified, fully qualified or relative names separated by commas. */
	QUALIFIED_NAME_LIST,

	/** {@code MemberModifierList? const ClassConstElementList ;} */
	CLASS_CONST_DECLARATION,
	CLASS_CONST_ELEMENT_LIST,
	/** {@code Identifier = expression} */
	CLASS_CONST_ELEMENT,
	/** Wraps a NAME token, possibly a keyword used as a member name. */
	IDENTIFIER,
	/** {@code MemberModifierList PropertyElementList ;} */
	PROPERTY_DECLARATION,
	PROPERTY_ELEMENT_LIST,
	/** {@code VARIABLE_NAME PropertyInitialiser?} */
	PROPERTY_ELEMENT,
	PROPERTY_INITIALISER,
	/** Modifier tokens: public, protected, private, static, abstract, final, var. */
	MEMBER_MODIFIER_LIST,
	/** {@code MethodDeclarationHeader MethodDeclarationBody} */
	METHOD_DECLARATION,
	/** {@code MemberModifierList? function &? Identifier ( ParameterDeclarationList? ) ReturnType?} */
	METHOD_DECLARATION_HEADER,
	METHOD_DECLARATION_BODY,

	/** {@code FunctionDeclarationHeader FunctionDeclarationBody} */
	FUNCTION_DECLARATION,
	/** {@code function &? NAME ( ParameterDeclarationList? ) ReturnType?} */
	FUNCTION_DECLARATION_HEADER,
	FUNCTION_DECLARATION_BODY,
	/** {@code : TypeDeclaration} */
	RETURN_TYPE,
	/** {@code ?? (QualifiedName | FullyQualifiedName | RelativeQualifiedName | array | callable)} */
	TYPE_DECLARATION,
	PARAMETER_DECLARATION_LIST,
	/** {@code TypeDeclaration? &? ...? VARIABLE_NAME DefaultArgumentSpecifier?} */
	PARAMETER_DECLARATION,
	DEFAULT_ARGUMENT_SPECIFIER,
	/** {@code const ConstElementList ;} */
	CONST_DECLARATION,
	CONST_ELEMENT_LIST,
	/** {@code NAME = expression} */
	CONST_ELEMENT,

	/** {@code AnonymousClassDeclarationHeader ClassDeclarationBody} */
	ANONYMOUS_CLASS_DECLARATION,
	/** {@code class ArgumentExpressionList? ClassBaseClause? ClassInterfaceClause?} */
	ANONYMOUS_CLASS_DECLARATION_HEADER,
	/** {@code AnonymousFunctionHeader FunctionDeclarationBody} */
	ANONYMOUS_FUNCTION_CREATION_EXPRESSION,
	/** {@code static? function &? ( ParameterDeclarationList? ) AnonymousFunctionUseClause? ReturnType?} */
	ANONYMOUS_FUNCTION_HEADER,
	/** {@code use ( ClosureUseList )} */
	ANONYMOUS_FUNCTION_USE_CLAUSE,
	CLOSURE_USE_LIST,
	/** {@code &? VARIABLE_NAME} */
	ANONYMOUS_FUNCTION_USE_VARIABLE,

	/** {@code VARIABLE_NAME} */
	SIMPLE_VARIABLE,
	/** {@code target = expression} */
	SIMPLE_ASSIGNMENT_EXPRESSION,
	/** {@code target = & expression} */
	BY_REF_ASSIGNMENT_EXPRESSION,
	FOREACH_STATEMENT,
	FOREACH_COLLECTION,
	FOREACH_KEY,
	FOREACH_VALUE,
	/** {@code catch ( CatchNameList VARIABLE_NAME ) CompoundStatement} */
	CATCH_CLAUSE,
	CATCH_NAME_LIST,
	/** {@code global VariableNameList ;} */
	GLOBAL_DECLARATION,
	VARIABLE_NAME_LIST,

	/** {@code callable ( ArgumentExpressionList? )} where callable is usually a name */
	FUNCTION_CALL_EXPRESSION,
	ARGUMENT_EXPRESSION_LIST,
	/** {@code new ClassTypeDesignator ArgumentExpressionList?} or {@code new AnonymousClassDeclaration} */
	OBJECT_CREATION_EXPRESSION,
	CLASS_TYPE_DESIGNATOR,
	/** A name used as a constant. */
	CONSTANT_ACCESS_EXPRESSION,
	/** {@code ( expression )} */
	ENCAPSULATED_EXPRESSION,
	/** {@code scope :: ScopedMemberName ( ArgumentExpressionList? )} */
	SCOPED_CALL_EXPRESSION,
	/** {@code scope :: ScopedMemberName} where the member is a VARIABLE_NAME */
	SCOPED_PROPERTY_ACCESS_EXPRESSION,
	/** {@code scope :: ScopedMemberName} where the member is an Identifier */
	CLASS_CONSTANT_ACCESS_EXPRESSION,
	/** Identifier or VARIABLE_NAME after {@code ::}. */
	SCOPED_MEMBER_NAME,
	/** {@code self}, {@code parent} (NAME tokens) or {@code static} (STATIC token). */
	RELATIVE_SCOPE,
	/** {@code expression -> MemberName} */
	PROPERTY_ACCESS_EXPRESSION,
	/** {@code expression -> MemberName ( ArgumentExpressionList? )} */
	METHOD_CALL_EXPRESSION,
	/** NAME token after {@code ->}. */
	MEMBER_NAME,

	RETURN_STATEMENT,
	IF_STATEMENT,
	OTHER
}

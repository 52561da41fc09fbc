/*
 * Copyright 2026 Google Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.structural.diag;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A templated diagnostic message with its arguments. */
@AutoValue
public abstract class AddendumMessage {

  /** A message kind. */
  public enum Kind {
    PROTOCOL_MEMBER_MISSING("\"%s\" is not present"),
    PROTOCOL_MEMBER_CLASS_VAR("\"%s\" is not a class variable"),
    MEMBER_TYPE_MISMATCH("\"%s\" is an incompatible type"),
    MEMBER_IS_INVARIANT("\"%s\" is invariant because it is mutable"),
    MEMBER_IS_FINAL_IN_PROTOCOL("\"%s\" is marked Final in protocol"),
    MEMBER_IS_NOT_FINAL_IN_PROTOCOL("\"%s\" is not marked Final in protocol"),
    TYPE_ASSIGNMENT_MISMATCH("Type \"%s\" cannot be assigned to type \"%s\""),
    TYPE_NOT_SAME("Type \"%s\" is not the same as type \"%s\""),
    TYPE_VAR_ASSIGNMENT_MISMATCH("Type \"%s\" cannot be assigned to type variable \"%s\""),
    TYPE_VAR_IS_COVARIANT(
        "Type parameter \"%s\" is covariant, but \"%s\" is not a subtype of \"%s\""),
    TYPE_VAR_IS_CONTRAVARIANT(
        "Type parameter \"%s\" is contravariant, but \"%s\" is not a supertype of \"%s\""),
    TYPE_VAR_IS_INVARIANT(
        "Type parameter \"%s\" is invariant, but \"%s\" is not the same as \"%s\""),
    LITERAL_ASSIGNMENT_MISMATCH("\"%s\" cannot be assigned to type \"%s\""),
    MISSING_GETTER("Property getter method is missing"),
    MISSING_SETTER("Property setter method is missing"),
    MISSING_DELETER("Property deleter method is missing"),
    INCOMPATIBLE_GETTER("Property getter method is incompatible"),
    INCOMPATIBLE_SETTER("Property setter method is incompatible"),
    INCOMPATIBLE_DELETER("Property deleter method is incompatible"),
    PARAM_TYPE_MISMATCH("Parameter \"%s\": type \"%s\" cannot be assigned to type \"%s\""),
    PARAM_NAME_MISMATCH("Parameter name mismatch: \"%s\" versus \"%s\""),
    TOO_FEW_POSITIONAL_PARAMS(
        "Function accepts too few positional parameters; expected %s but received %s"),
    TOO_MANY_POSITIONAL_PARAMS(
        "Function accepts too many positional parameters; expected %s but received %s"),
    VAR_ARGS_MISSING("Parameter \"*%s\" has no corresponding parameter"),
    RETURN_TYPE_MISMATCH("Function return type \"%s\" is incompatible with type \"%s\""),
    NO_OVERLOAD_ASSIGNABLE("No overloaded function matches type \"%s\""),
    OVERLOAD_NOT_ASSIGNABLE("Overload %s is not compatible"),
    PROTOCOL_VARIANCE_COVARIANT(
        "Type variable \"%s\" used in generic protocol \"%s\" should be covariant"),
    PROTOCOL_VARIANCE_CONTRAVARIANT(
        "Type variable \"%s\" used in generic protocol \"%s\" should be contravariant"),
    PROTOCOL_VARIANCE_INVARIANT(
        "Type variable \"%s\" used in generic protocol \"%s\" should be invariant");

    private final String template;

    Kind(String template) {
      this.template = template;
    }

    String format(ImmutableList<Object> args) {
      return String.format(template, args.toArray());
    }
  }

  public static AddendumMessage create(Kind kind, Object... args) {
    return new AutoValue_AddendumMessage(kind, ImmutableList.copyOf(args));
  }

  public abstract Kind kind();

  public abstract ImmutableList<Object> args();

  /** The formatted message. */
  public String message() {
    return kind().format(args());
  }

  @Override
  public final String toString() {
    return message();
  }
}

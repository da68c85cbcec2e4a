/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package scilla.parser.sr;

/**
 * What a name on the operand stack or in the definition table refers to
 */
public enum SrIdentifierKind {
  FUNCTION_NAME,
  STATIC_FUNCTION_NAME,
  TRANSITION_NAME,
  PROCEDURE_NAME,
  TEMPLATE_FUNCTION_NAME,
  EXTERNAL_FUNCTION_NAME,

  TYPE_NAME,
  COMPONENT_NAME,
  EVENT,
  NAMESPACE,
  BLOCK_LABEL,

  CONTEXT_RESOURCE,

  // Storage and reference
  VIRTUAL_REGISTER,
  VIRTUAL_REGISTER_INTERMEDIATE,
  MEMORY,
  STATE,

  /** Not enough context yet to decide */
  UNKNOWN,
}

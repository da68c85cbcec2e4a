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
package scilla.parser.ast.nodes;

import java.util.List;

import com.google.common.collect.ImmutableList;

import scilla.parser.ast.AstConverting;
import scilla.parser.ast.AstNode;
import scilla.parser.ast.AstVisitor;
import scilla.parser.ast.Children;
import scilla.parser.ast.TraversalResult;
import scilla.parser.ast.TreeTraversalMode;
import scilla.parser.ast.WithMetaData;
import scilla.parser.common.exceptions.AstVisitException;

/**
 * Read of another contract's state: <code>x <- & addr.field</code>
 * and its variants
 */
public abstract class NodeRemoteFetchStatement extends AstNode {
  public enum Kind {
    READ_STATE_MUTABLE,
    READ_STATE_MUTABLE_SPECIAL_ID,
    READ_STATE_MUTABLE_MAP_ACCESS,
    READ_STATE_MUTABLE_MAP_ACCESS_EXISTS,
    READ_STATE_MUTABLE_CAST_ADDRESS,
  }

  private final String leftHandSide;

  private NodeRemoteFetchStatement(String leftHandSide) {
    this.leftHandSide = leftHandSide;
  }

  public abstract Kind kind();

  public String leftHandSide() {
    return leftHandSide;
  }

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitRemoteFetchStatement(mode, this);
  }

  public static class ReadStateMutable extends NodeRemoteFetchStatement {
    private final String address;
    private final String identifier;

    public ReadStateMutable(String leftHandSide, String address,
                            String identifier) {
      super(leftHandSide);
      this.address = address;
      this.identifier = identifier;
    }

    public String address() {
      return address;
    }

    public String identifier() {
      return identifier;
    }

    @Override
    public Kind kind() {
      return Kind.READ_STATE_MUTABLE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  /** <code>x <- & addr._balance</code> */
  public static class ReadStateMutableSpecialId
                          extends NodeRemoteFetchStatement {
    private final String address;
    private final String identifier;

    public ReadStateMutableSpecialId(String leftHandSide, String address,
                                     String identifier) {
      super(leftHandSide);
      this.address = address;
      this.identifier = identifier;
    }

    public String address() {
      return address;
    }

    public String identifier() {
      return identifier;
    }

    @Override
    public Kind kind() {
      return Kind.READ_STATE_MUTABLE_SPECIAL_ID;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  public abstract static class RemoteMapRead
                          extends NodeRemoteFetchStatement {
    private final String address;
    private final String memberId;
    private final List<WithMetaData<NodeMapAccess>> mapAccesses;

    private RemoteMapRead(String leftHandSide, String address,
                String memberId, List<WithMetaData<NodeMapAccess>> mapAccesses) {
      super(leftHandSide);
      this.address = address;
      this.memberId = memberId;
      this.mapAccesses = ImmutableList.copyOf(mapAccesses);
    }

    public String address() {
      return address;
    }

    public String memberId() {
      return memberId;
    }

    public List<WithMetaData<NodeMapAccess>> mapAccesses() {
      return mapAccesses;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().addAll(mapAccesses).build();
    }
  }

  public static class ReadStateMutableMapAccess extends RemoteMapRead {
    public ReadStateMutableMapAccess(String leftHandSide, String address,
                String memberId, List<WithMetaData<NodeMapAccess>> mapAccesses) {
      super(leftHandSide, address, memberId, mapAccesses);
    }

    @Override
    public Kind kind() {
      return Kind.READ_STATE_MUTABLE_MAP_ACCESS;
    }
  }

  public static class ReadStateMutableMapAccessExists extends RemoteMapRead {
    public ReadStateMutableMapAccessExists(String leftHandSide,
                String address, String memberId,
                List<WithMetaData<NodeMapAccess>> mapAccesses) {
      super(leftHandSide, address, memberId, mapAccesses);
    }

    @Override
    public Kind kind() {
      return Kind.READ_STATE_MUTABLE_MAP_ACCESS_EXISTS;
    }
  }

  /** <code>x <- & a as ByStr20 with ... end</code> */
  public static class ReadStateMutableCastAddress
                          extends NodeRemoteFetchStatement {
    private final WithMetaData<NodeVariableIdentifier> address;
    private final WithMetaData<NodeAddressType> addressType;

    public ReadStateMutableCastAddress(String leftHandSide,
                WithMetaData<NodeVariableIdentifier> address,
                WithMetaData<NodeAddressType> addressType) {
      super(leftHandSide);
      this.address = address;
      this.addressType = addressType;
    }

    public WithMetaData<NodeVariableIdentifier> address() {
      return address;
    }

    public WithMetaData<NodeAddressType> addressType() {
      return addressType;
    }

    @Override
    public Kind kind() {
      return Kind.READ_STATE_MUTABLE_CAST_ADDRESS;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(address, addressType);
    }
  }
}

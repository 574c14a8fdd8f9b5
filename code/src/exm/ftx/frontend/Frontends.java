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
package exm.ftx.frontend;

import java.util.List;

import org.apache.log4j.Logger;

import exm.ftx.ast.ParseNode;
import exm.ftx.ast.XmlParseNode;
import exm.ftx.common.Logging;
import exm.ftx.common.Settings;
import exm.ftx.common.exceptions.InvalidOptionException;
import exm.ftx.common.exceptions.FTXRuntimeError;
import exm.ftx.common.exceptions.UserException;
import exm.ftx.frontend.fp.FPLowering;
import exm.ftx.frontend.fp.FPTree;
import exm.ftx.frontend.ofp.OFPLowering;
import exm.ftx.frontend.omni.OMNILowering;
import exm.ftx.ir.Statement;

/**
 * Entry points selecting the lowering for a front end
 */
public class Frontends {

  private static final Logger logger = Logging.getFTXLogger();

  /**
   * Apply system property overrides to the settings and set up logging
   * from ftx.log.file and ftx.log.trace.
   */
  public static Logger init() throws InvalidOptionException {
    Settings.initFTXProperties();
    return Logging.setupLogging(Settings.get(Settings.LOG_FILE),
                                Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * Lower a parse tree to top-level IR statements
   * @param frontend front end that produced the tree
   * @param root root of the tree, of the node type of the front end
   * @param file name of the source file, for messages, or null
   * @param rawSource raw source text the tree's positions refer to
   */
  public static List<Statement> lower(Frontend frontend, ParseNode root,
        String file, String rawSource) throws UserException {
    logger.debug("Lowering " + frontend + " tree of " + file);
    switch (frontend) {
      case OFP:
        return new OFPLowering(file, rawSource).lowerProgram(
                                        checkXml(frontend, root));
      case OMNI:
        return new OMNILowering(file, rawSource).lowerProgram(
                                        checkXml(frontend, root));
      case FP:
        if (!(root instanceof FPTree)) {
          throw new FTXRuntimeError("Expected FPTree for " + frontend +
                                    " but got " + root.getClass());
        }
        return new FPLowering(file, rawSource).lowerProgram((FPTree)root);
      default:
        throw new FTXRuntimeError("Unknown front end " + frontend);
    }
  }

  /**
   * Parse an XML document emitted by an XML front end and lower it
   */
  public static List<Statement> lowerXml(Frontend frontend, String xml,
        String file, String rawSource) throws UserException {
    if (!frontend.isXml()) {
      throw new FTXRuntimeError(frontend + " does not produce XML");
    }
    return lower(frontend, XmlParseNode.parse(xml), file, rawSource);
  }

  private static XmlParseNode checkXml(Frontend frontend, ParseNode root) {
    if (!(root instanceof XmlParseNode)) {
      throw new FTXRuntimeError("Expected XML tree for " + frontend +
                                " but got " + root.getClass());
    }
    return (XmlParseNode)root;
  }
}
